package Sequence.Statements;

import Cluster.GenericField;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.VariableReferenceImpl;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a field of an owner value.
 */
public class FieldStatement extends Statement {
    private final GenericField field;
    private VariableReference source;

    public FieldStatement(TestCase testCase, GenericField field, VariableReference source) {
        super(testCase, new VariableReferenceImpl(testCase, field.getFieldType()));
        if (source == null) {
            throw new IllegalArgumentException("A field statement needs an owner: " + field);
        }
        this.field = field;
        this.source = source;
    }

    public GenericField getField() {
        return field;
    }

    public VariableReference getSource() {
        return source;
    }

    @Override
    public Set<VariableReference> getVariableReferences() {
        Set<VariableReference> references = new LinkedHashSet<>();
        references.add(returnValue);
        references.add(source);
        return references;
    }

    @Override
    public void replace(VariableReference oldReference, VariableReference newReference) {
        if (source == oldReference) {
            source = newReference;
        }
        if (returnValue == oldReference) {
            returnValue = newReference;
        }
    }

    @Override
    public Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo) {
        return new FieldStatement(newTestCase, field, source.clone(memo));
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitFieldStatement(this);
    }

    @Override
    public boolean structuralEquals(Statement other, Map<VariableReference, VariableReference> memo) {
        if (!(other instanceof FieldStatement)) {
            return false;
        }
        FieldStatement that = (FieldStatement) other;
        return field.equals(that.field) && source.structuralEquals(that.source, memo);
    }

    @Override
    public int structuralHashCode() {
        return Objects.hash(field, source.structuralHashCode());
    }

    @Override
    public String toString() {
        return source + "." + field.getName();
    }
}
