package pygen.model.typed;

public abstract class TypedPatternVisitor<T, E extends Throwable> {
	public abstract T visit(TypedVariablePattern variablePattern) throws E;
	public abstract T visit(TypedDiscardPattern discardPattern) throws E;
	public abstract T visit(TypedTuplePattern tuplePattern) throws E;
	public abstract T visit(TypedConstructorPattern constructorPattern) throws E;
}
