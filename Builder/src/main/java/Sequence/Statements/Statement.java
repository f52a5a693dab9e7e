package Sequence.Statements;

import Sequence.TestCase;
import Sequence.VariableReference;

import java.util.Map;
import java.util.Set;

/**
 * One line of a test case. Defines exactly one value, its return value.
 */
public abstract class Statement {
    protected final TestCase testCase;
    protected VariableReference returnValue;

    protected Statement(TestCase testCase, VariableReference returnValue) {
        this.testCase = testCase;
        this.returnValue = returnValue;
    }

    public TestCase getTestCase() {
        return testCase;
    }

    public VariableReference getReturnValue() {
        return returnValue;
    }

    public int getPosition() {
        return returnValue.getStPosition();
    }

    /**
     * @return every reference this statement defines or uses
     */
    public abstract Set<VariableReference> getVariableReferences();

    /**
     * Replaces every use of oldReference by newReference.
     */
    public abstract void replace(VariableReference oldReference, VariableReference newReference);

    /**
     * Copies this statement into another test case, mapping used references
     * through memo.
     */
    public abstract Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo);

    public abstract void accept(StatementVisitor visitor);

    public abstract boolean structuralEquals(Statement other, Map<VariableReference, VariableReference> memo);

    public abstract int structuralHashCode();
}
