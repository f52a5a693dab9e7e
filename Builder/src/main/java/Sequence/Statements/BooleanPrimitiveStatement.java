package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import utils.Randomness;

public class BooleanPrimitiveStatement extends PrimitiveStatement<Boolean> {

    public BooleanPrimitiveStatement(TestCase testCase, Boolean value) {
        super(testCase, ParameterType.BOOLEAN, value);
    }

    public BooleanPrimitiveStatement(TestCase testCase) {
        this(testCase, Boolean.FALSE);
    }

    @Override
    protected Boolean randomValue(Randomness randomness, LiteralBounds bounds) {
        return randomness.nextBoolean();
    }

    @Override
    protected PrimitiveStatement<Boolean> copy(TestCase newTestCase) {
        return new BooleanPrimitiveStatement(newTestCase, value);
    }
}
