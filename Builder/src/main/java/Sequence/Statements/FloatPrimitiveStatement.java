package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import utils.Randomness;

import java.util.Arrays;
import java.util.List;

public class FloatPrimitiveStatement extends PrimitiveStatement<Double> {
    private static final List<Double> EXTREME_VALUES = Arrays.asList(
            Double.MIN_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE,
            Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN,
            0.0, -0.0, 1.0, -1.0);

    public FloatPrimitiveStatement(TestCase testCase, Double value) {
        super(testCase, ParameterType.FLOAT, value);
    }

    public FloatPrimitiveStatement(TestCase testCase) {
        this(testCase, 0.0);
    }

    @Override
    protected Double randomValue(Randomness randomness, LiteralBounds bounds) {
        // two decimals keep the printed literal short
        double raw = randomness.nextGaussian() * bounds.getMaxInt();
        return Math.round(raw * 100.0) / 100.0;
    }

    @Override
    protected List<Double> getExtremeValues() {
        return EXTREME_VALUES;
    }

    @Override
    protected PrimitiveStatement<Double> copy(TestCase newTestCase) {
        return new FloatPrimitiveStatement(newTestCase, value);
    }
}
