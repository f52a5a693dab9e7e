package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import utils.Randomness;

import java.util.Arrays;
import java.util.List;

public class IntPrimitiveStatement extends PrimitiveStatement<Integer> {
    private static final List<Integer> EXTREME_VALUES =
            Arrays.asList(Integer.MIN_VALUE, Integer.MAX_VALUE, 0, -1, 1);

    public IntPrimitiveStatement(TestCase testCase, Integer value) {
        super(testCase, ParameterType.INT, value);
    }

    public IntPrimitiveStatement(TestCase testCase) {
        this(testCase, 0);
    }

    @Override
    protected Integer randomValue(Randomness randomness, LiteralBounds bounds) {
        return (int) randomness.nextLong(-bounds.getMaxInt(), bounds.getMaxInt() + 1L);
    }

    @Override
    protected List<Integer> getExtremeValues() {
        return EXTREME_VALUES;
    }

    @Override
    protected PrimitiveStatement<Integer> copy(TestCase newTestCase) {
        return new IntPrimitiveStatement(newTestCase, value);
    }
}
