package Sequence.Statements;

import Cluster.GenericFunction;
import Sequence.TestCase;
import Sequence.VariableReference;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class FunctionStatement extends ParametrizedStatement {

    public FunctionStatement(TestCase testCase, GenericFunction function, List<VariableReference> args) {
        super(testCase, function, args, function.getInferredSignature().getReturnType());
    }

    public FunctionStatement(TestCase testCase, GenericFunction function) {
        this(testCase, function, Collections.emptyList());
    }

    public GenericFunction getFunction() {
        return (GenericFunction) genericCallableAccessibleObject;
    }

    @Override
    public Statement clone(TestCase newTestCase, Map<VariableReference, VariableReference> memo) {
        return new FunctionStatement(newTestCase, getFunction(), cloneArgs(memo));
    }

    @Override
    public void accept(StatementVisitor visitor) {
        visitor.visitFunctionStatement(this);
    }

    @Override
    public String toString() {
        return getFunction().getName() + argsToString();
    }
}
