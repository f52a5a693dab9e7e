package Sequence;

import Cluster.ParameterType;
import Sequence.Statements.Statement;

import java.util.List;
import java.util.Map;

public class VariableReferenceImpl extends VariableReference {

    public VariableReferenceImpl(TestCase testCase, ParameterType type) {
        super(testCase, type);
    }

    @Override
    public VariableReference clone(Map<VariableReference, VariableReference> memo) {
        VariableReference copy = memo.get(this);
        if (copy == null) {
            throw new IllegalStateException("No counterpart for " + this + " in the cloned test case");
        }
        return copy;
    }

    @Override
    public int getStPosition() {
        List<Statement> statements = testCase.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).getReturnValue() == this) {
                return i;
            }
        }
        throw new IllegalStateException(
                "Variable reference is not declared in the test case in which it is used");
    }
}
