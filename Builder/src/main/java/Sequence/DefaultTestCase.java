package Sequence;

import Cluster.ParameterType;
import Sequence.Statements.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A test case is a list of statements.
 */
public class DefaultTestCase implements TestCase {

    private static final AtomicInteger idGenerator = new AtomicInteger(0);

    private final List<Statement> statements = new ArrayList<>();

    private final int id;

    public DefaultTestCase() {
        id = idGenerator.getAndIncrement();
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int size() {
        return statements.size();
    }

    @Override
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public Statement getStatement(int position) {
        if (!hasStatement(position)) {
            throw new IndexOutOfBoundsException("No statement at position " + position + ", size is " + size());
        }
        return statements.get(position);
    }

    @Override
    public boolean hasStatement(int position) {
        return position >= 0 && position < statements.size();
    }

    @Override
    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public VariableReference addStatement(Statement statement) {
        return addStatement(statement, statements.size());
    }

    @Override
    public VariableReference addStatement(Statement statement, int position) {
        checkOwner(statement);
        if (position < 0 || position > statements.size()) {
            throw new IndexOutOfBoundsException("Cannot insert at " + position + ", size is " + size());
        }
        statements.add(position, statement);
        return statement.getReturnValue();
    }

    @Override
    public void addStatements(List<? extends Statement> newStatements) {
        for (Statement statement : newStatements) {
            addStatement(statement);
        }
    }

    @Override
    public VariableReference setStatement(Statement statement, int position) {
        checkOwner(statement);
        if (!hasStatement(position)) {
            throw new IndexOutOfBoundsException("No statement to replace at position " + position);
        }
        statements.set(position, statement);
        return statement.getReturnValue();
    }

    @Override
    public void remove(int position) {
        if (hasStatement(position)) {
            statements.remove(position);
        }
    }

    @Override
    public void chop(int position) {
        while (statements.size() > position + 1 && !statements.isEmpty()) {
            statements.remove(statements.size() - 1);
        }
    }

    @Override
    public boolean contains(Statement statement) {
        return statements.contains(statement);
    }

    @Override
    public List<VariableReference> getObjects(ParameterType type, int position) {
        List<VariableReference> variables = new ArrayList<>();
        if (type == null || type.isUnknown()) {
            return variables;
        }
        for (int i = 0; i < position && i < statements.size(); i++) {
            VariableReference value = statements.get(i).getReturnValue();
            if (value != null && matches(type, value.getType())) {
                variables.add(value);
            }
        }
        return variables;
    }

    /* a union-typed value may be any of its arms */
    private static boolean matches(ParameterType requested, ParameterType actual) {
        if (requested.equals(actual)) {
            return true;
        }
        return actual != null && actual.isUnion() && actual.getArms().contains(requested);
    }

    @Override
    public List<VariableReference> getAllObjects(int position) {
        List<VariableReference> variables = new ArrayList<>();
        for (int i = 0; i < position && i < statements.size(); i++) {
            VariableReference value = statements.get(i).getReturnValue();
            if (value != null) {
                variables.add(value);
            }
        }
        return variables;
    }

    @Override
    public Set<VariableReference> getDependencies(VariableReference reference) {
        Set<VariableReference> dependencies = new LinkedHashSet<>();
        Deque<VariableReference> toProcess = new ArrayDeque<>();
        toProcess.add(reference);
        while (!toProcess.isEmpty()) {
            VariableReference current = toProcess.poll();
            if (!dependencies.add(current)) {
                continue;
            }
            Statement definition = statements.get(current.getStPosition());
            for (VariableReference used : definition.getVariableReferences()) {
                if (used != current && !dependencies.contains(used)) {
                    toProcess.add(used);
                }
            }
        }
        return dependencies;
    }

    @Override
    public boolean isValid() {
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            for (VariableReference used : statement.getVariableReferences()) {
                if (used == statement.getReturnValue()) {
                    continue;
                }
                if (used.getTestCase() != this) {
                    return false;
                }
                int definedAt = statements.indexOf(findDefinition(used));
                if (definedAt < 0 || definedAt >= i) {
                    return false;
                }
            }
        }
        return true;
    }

    private Statement findDefinition(VariableReference reference) {
        for (Statement statement : statements) {
            if (statement.getReturnValue() == reference) {
                return statement;
            }
        }
        return null;
    }

    @Override
    public void appendTestCase(TestCase other) {
        Map<VariableReference, VariableReference> memo = new HashMap<>();
        for (Statement statement : other.getStatements()) {
            Statement copy = statement.clone(this, memo);
            statements.add(copy);
            memo.put(statement.getReturnValue(), copy.getReturnValue());
        }
    }

    @Override
    public DefaultTestCase clone() {
        DefaultTestCase copy = new DefaultTestCase();
        copy.appendTestCase(this);
        return copy;
    }

    private void checkOwner(Statement statement) {
        if (statement.getTestCase() != this) {
            throw new IllegalArgumentException("Statement " + statement + " belongs to another test case");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof DefaultTestCase))
            return false;
        DefaultTestCase other = (DefaultTestCase) obj;
        if (statements.size() != other.statements.size())
            return false;

        Map<VariableReference, VariableReference> memo = new HashMap<>();
        for (int i = 0; i < statements.size(); i++) {
            Statement left = statements.get(i);
            Statement right = other.statements.get(i);
            if (!left.structuralEquals(right, memo))
                return false;
            memo.put(left.getReturnValue(), right.getReturnValue());
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 31;
        for (Statement statement : statements) {
            result = 31 * result + statement.structuralHashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DefaultTestCase#" + id + " {\n");
        for (int i = 0; i < statements.size(); i++) {
            sb.append("  ").append(i).append(": ").append(statements.get(i)).append('\n');
        }
        return sb.append('}').toString();
    }
}
