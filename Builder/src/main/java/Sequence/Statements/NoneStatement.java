package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import utils.Randomness;

/**
 * A null value, recorded with the type it stands in for.
 */
public class NoneStatement extends PrimitiveStatement<Void> {

    public NoneStatement(TestCase testCase, ParameterType type) {
        super(testCase, type, null);
    }

    @Override
    public void randomizeValue(Randomness randomness, LiteralBounds bounds) {
        // there is only one null
    }

    @Override
    protected Void randomValue(Randomness randomness, LiteralBounds bounds) {
        return null;
    }

    @Override
    protected PrimitiveStatement<Void> copy(TestCase newTestCase) {
        return new NoneStatement(newTestCase, returnValue.getType());
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitNoneStatement(this);
    }

    @Override
    public String toString() {
        return "null";
    }
}
