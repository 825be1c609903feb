package pygen.model.typed;

import pygen.util.SourceSpan;

public abstract class TypedExpression extends TypedNode {

	public TypedExpression(SourceSpan location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E;
}
