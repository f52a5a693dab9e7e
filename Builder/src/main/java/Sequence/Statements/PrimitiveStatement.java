package Sequence.Statements;

import Cluster.ParameterType;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.VariableReferenceImpl;
import utils.Randomness;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A literal value of a primitive type.
 */
public abstract class PrimitiveStatement<T> extends Statement {
    protected T value;

    protected PrimitiveStatement(TestCase testCase, ParameterType type, T value) {
        super(testCase, new VariableReferenceImpl(testCase, type));
        this.value = value;
    }

    public T getValue() {
        return value;
    }

    public void setValue(T value) {
        this.value = value;
    }

    /**
     * Assigns a fresh random value within the given bounds. With the extreme
     * value probability of the bounds the value is drawn from the extreme
     * values of the type instead.
     */
    public void randomizeValue(Randomness randomness, LiteralBounds bounds) {
        List<T> extremes = getExtremeValues();
        if (bounds.isExtremeValuesEnabled() && !extremes.isEmpty()
                && randomness.nextFloat() < bounds.getExtremeValueProbability()) {
            value = randomness.choice(extremes);
        } else {
            value = randomValue(randomness, bounds);
        }
    }

    public void randomizeValue(Randomness randomness) {
        randomizeValue(randomness, LiteralBounds.fromConfig());
    }

    protected abstract T randomValue(Randomness randomness, LiteralBounds bounds);

    protected List<T> getExtremeValues() {
        return Collections.emptyList();
    }

    /* copy of this literal, defined in another test case */
    protected abstract PrimitiveStatement<T> copy(TestCase newTestCase);

    @Override
    public Set<VariableReference> getVariableReferences() {
        return Collections.singleton(returnValue);
    }

    @Override
    public void replace(VariableReference oldReference, VariableReference newReference) {
        if (returnValue == oldReference) {
            returnValue = newReference;
        }
    }

    @Override
    public Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo) {
        PrimitiveStatement<T> copy = copy(newTestCase);
        copy.getReturnValue().setDistance(returnValue.getDistance());
        return copy;
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitPrimitiveStatement(this);
    }

    @Override
    public boolean structuralEquals(Statement other, Map<VariableReference, VariableReference> memo) {
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        PrimitiveStatement<?> that = (PrimitiveStatement<?>) other;
        return Objects.equals(value, that.value)
                && returnValue.getType().equals(that.returnValue.getType());
    }

    @Override
    public int structuralHashCode() {
        return Objects.hash(getClass(), value, returnValue.structuralHashCode());
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
