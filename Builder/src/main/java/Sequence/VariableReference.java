package Sequence;

import Cluster.ParameterType;

import java.util.Map;

/**
 * Handle to the value produced by exactly one statement of a test case.
 * Identity is the defining statement; type and distance may change.
 */
public abstract class VariableReference {
    protected final TestCase testCase;
    protected ParameterType type;
    protected int distance = 0;

    protected VariableReference(TestCase testCase, ParameterType type) {
        this.testCase = testCase;
        this.type = type == null ? ParameterType.unknown() : type;
    }

    /**
     * Looks up the counterpart of this reference in a cloned test case.
     * References are never copied themselves, only statements are.
     *
     * @param memo mapping from old to new references
     * @return the corresponding reference in the new test case
     */
    public abstract VariableReference clone(Map<VariableReference, VariableReference> memo);

    /**
     * @return position of the statement defining this reference
     */
    public abstract int getStPosition();

    public TestCase getTestCase() {
        return testCase;
    }

    public ParameterType getType() {
        return type;
    }

    public void setType(ParameterType type) {
        this.type = type == null ? ParameterType.unknown() : type;
    }

    /**
     * Distance to the subject under test, i.e. the recursion depth at which
     * the defining statement was created.
     */
    public int getDistance() {
        return distance;
    }

    public void setDistance(int distance) {
        this.distance = distance;
    }

    public boolean isPrimitive() {
        return type.isPrimitive();
    }

    public boolean isNoneType() {
        return type.isNoneType();
    }

    public boolean isTypeUnknown() {
        return type.isUnknown();
    }

    /**
     * Two references are structurally equal when their types are equal and
     * the memo maps this reference onto the other one.
     */
    public boolean structuralEquals(Object other, Map<VariableReference, VariableReference> memo) {
        if (!(other instanceof VariableReference)) {
            return false;
        }
        VariableReference that = (VariableReference) other;
        return type.equals(that.type) && memo.get(this) == that;
    }

    public int structuralHashCode() {
        return 31 * 17 + type.hashCode();
    }

    @Override
    public String toString() {
        return type.toString();
    }
}
