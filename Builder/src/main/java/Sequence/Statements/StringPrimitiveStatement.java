package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import utils.Randomness;

import java.util.Arrays;
import java.util.List;

public class StringPrimitiveStatement extends PrimitiveStatement<String> {
    private static final List<String> EXTREME_VALUES = Arrays.asList("", " ", "\n", "\t", "\0");

    public StringPrimitiveStatement(TestCase testCase, String value) {
        super(testCase, ParameterType.STRING, value);
    }

    public StringPrimitiveStatement(TestCase testCase) {
        this(testCase, "");
    }

    @Override
    protected String randomValue(Randomness randomness, LiteralBounds bounds) {
        int length = randomness.nextInt(bounds.getMaxStringLength() + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(randomness.nextChar());
        }
        return sb.toString();
    }

    @Override
    protected List<String> getExtremeValues() {
        return EXTREME_VALUES;
    }

    @Override
    protected PrimitiveStatement<String> copy(TestCase newTestCase) {
        return new StringPrimitiveStatement(newTestCase, value);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
