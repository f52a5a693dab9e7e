package Sequence.Statements;

import Cluster.GenericCallableAccessibleObject;
import Cluster.ParameterType;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.VariableReferenceImpl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A call of a constructor, method or function with its argument values.
 */
public abstract class ParametrizedStatement extends Statement {
    protected final GenericCallableAccessibleObject genericCallableAccessibleObject;
    protected final List<VariableReference> args;

    protected ParametrizedStatement(TestCase testCase, GenericCallableAccessibleObject callable,
                                    List<VariableReference> args, ParameterType returnType) {
        super(testCase, new VariableReferenceImpl(testCase, returnType));
        this.genericCallableAccessibleObject = callable;
        this.args = args == null ? new ArrayList<>() : new ArrayList<>(args);
    }

    public GenericCallableAccessibleObject getAccessibleObject() {
        return genericCallableAccessibleObject;
    }

    public List<VariableReference> getArgs() {
        return Collections.unmodifiableList(args);
    }

    @Override
    public Set<VariableReference> getVariableReferences() {
        Set<VariableReference> references = new LinkedHashSet<>();
        references.add(returnValue);
        references.addAll(args);
        return references;
    }

    @Override
    public void replace(VariableReference oldReference, VariableReference newReference) {
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == oldReference) {
                args.set(i, newReference);
            }
        }
        if (returnValue == oldReference) {
            returnValue = newReference;
        }
    }

    protected List<VariableReference> cloneArgs(Map<VariableReference, VariableReference> memo) {
        List<VariableReference> copies = new ArrayList<>(args.size());
        for (VariableReference arg : args) {
            copies.add(arg.clone(memo));
        }
        return copies;
    }

    @Override
    public boolean structuralEquals(Statement other, Map<VariableReference, VariableReference> memo) {
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ParametrizedStatement that = (ParametrizedStatement) other;
        if (!genericCallableAccessibleObject.equals(that.genericCallableAccessibleObject)
                || args.size() != that.args.size()) {
            return false;
        }
        for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).structuralEquals(that.args.get(i), memo)) {
                return false;
            }
        }
        return returnValue.getType().equals(that.returnValue.getType());
    }

    @Override
    public int structuralHashCode() {
        int hash = Objects.hash(genericCallableAccessibleObject, returnValue.structuralHashCode());
        for (VariableReference arg : args) {
            hash = 31 * hash + arg.structuralHashCode();
        }
        return hash;
    }

    protected String argsToString() {
        StringBuilder sb = new StringBuilder("(");
        for (VariableReference arg : args) {
            if (sb.length() > 1)
                sb.append(", ");
            sb.append(arg);
        }
        return sb.append(')').toString();
    }
}
