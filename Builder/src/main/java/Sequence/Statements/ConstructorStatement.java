package Sequence.Statements;

import Cluster.GenericConstructor;
import Sequence.TestCase;
import Sequence.VariableReference;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ConstructorStatement extends ParametrizedStatement {

    public ConstructorStatement(TestCase testCase, GenericConstructor constructor, List<VariableReference> args) {
        super(testCase, constructor, args, constructor.getOwner());
    }

    public ConstructorStatement(TestCase testCase, GenericConstructor constructor) {
        this(testCase, constructor, Collections.emptyList());
    }

    public GenericConstructor getConstructor() {
        return (GenericConstructor) genericCallableAccessibleObject;
    }

    @Override
    public Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo) {
        return new ConstructorStatement(newTestCase, getConstructor(), cloneArgs(memo));
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitConstructorStatement(this);
    }

    @Override
    public String toString() {
        return "new " + getConstructor().getOwner() + argsToString();
    }
}
