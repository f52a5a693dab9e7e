package Sequence.Statements;

import Cluster.GenericMethod;
import Sequence.TestCase;
import Sequence.VariableReference;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class MethodStatement extends ParametrizedStatement {
    private VariableReference callee;

    public MethodStatement(TestCase testCase, GenericMethod method, VariableReference callee,
                           List<VariableReference> args) {
        super(testCase, method, args, method.getInferredSignature().getReturnType());
        if (callee == null) {
            throw new IllegalArgumentException("A method statement needs a callee: " + method);
        }
        this.callee = callee;
    }

    public MethodStatement(TestCase testCase, GenericMethod method, VariableReference callee) {
        this(testCase, method, callee, Collections.emptyList());
    }

    public GenericMethod getMethod() {
        return (GenericMethod) genericCallableAccessibleObject;
    }

    public VariableReference getCallee() {
        return callee;
    }

    @Override
    public Set<VariableReference> getVariableReferences() {
        Set<VariableReference> references = super.getVariableReferences();
        references.add(callee);
        return references;
    }

    @Override
    public void replace(VariableReference oldReference, VariableReference newReference) {
        super.replace(oldReference, newReference);
        if (callee == oldReference) {
            callee = newReference;
        }
    }

    @Override
    public Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo) {
        return new MethodStatement(newTestCase, getMethod(), callee.clone(memo), cloneArgs(memo));
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitMethodStatement(this);
    }

    @Override
    public boolean structuralEquals(Statement other, Map<VariableReference, VariableReference> memo) {
        return super.structuralEquals(other, memo)
                && callee.structuralEquals(((MethodStatement) other).callee, memo);
    }

    @Override
    public int structuralHashCode() {
        return 31 * super.structuralHashCode() + callee.structuralHashCode();
    }

    @Override
    public String toString() {
        return callee + "." + getMethod().getName() + argsToString();
    }
}
