package Sequence.Statements;

public interface StatementVisitor {

    void visitConstructorStatement(ConstructorStatement statement);

    void visitMethodStatement(MethodStatement statement);

    void visitFunctionStatement(FunctionStatement statement);

    void visitFieldStatement(FieldStatement statement);

    void visitPrimitiveStatement(PrimitiveStatement<?> statement);

    void visitNoneStatement(NoneStatement statement);
}
