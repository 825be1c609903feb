package pygen.model.typed;

public abstract class TypedStatementVisitor<T, E extends Throwable> {
	public abstract T visit(TypedExpressionStatement expressionStatement) throws E;
	public abstract T visit(TypedAssignment assignment) throws E;
	public abstract T visit(TypedUse typedUse) throws E;
}
