package Sequence;

import Cluster.ParameterType;
import Sequence.Statements.Statement;

import java.util.List;
import java.util.Set;

/**
 * An ordered sequence of statements. Every statement only refers to values
 * defined at smaller positions.
 */
public interface TestCase {

    int getId();

    int size();

    boolean isEmpty();

    /**
     * @throws IndexOutOfBoundsException if position is not in [0, size())
     */
    Statement getStatement(int position);

    boolean hasStatement(int position);

    List<Statement> getStatements();

    /**
     * Appends a statement.
     *
     * @return the value defined by the statement
     */
    VariableReference addStatement(Statement statement);

    /**
     * Inserts a statement, shifting later statements by one.
     *
     * @return the value defined by the statement
     */
    VariableReference addStatement(Statement statement, int position);

    void addStatements(List<? extends Statement> statements);

    /**
     * Replaces the statement at an existing position.
     *
     * @return the value defined by the new statement
     */
    VariableReference setStatement(Statement statement, int position);

    /* removes the statement at position, no-op when there is none */
    void remove(int position);

    /**
     * Keeps the statements up to and including position.
     */
    void chop(int position);

    boolean contains(Statement statement);

    /**
     * @return values defined before position whose recorded type equals type,
     * or is a union having type as an arm; empty for an unknown type
     */
    List<VariableReference> getObjects(ParameterType type, int position);

    /**
     * @return every value defined before position
     */
    List<VariableReference> getAllObjects(int position);

    /**
     * @return the reference and every reference it transitively depends on
     */
    Set<VariableReference> getDependencies(VariableReference reference);

    /**
     * @return true if no statement refers to a value at its own or a later position
     */
    boolean isValid();

    void appendTestCase(TestCase other);

    TestCase clone();
}
