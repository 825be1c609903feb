package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedExpressionStatement extends TypedStatement {

	private final TypedExpression expression;

	public TypedExpressionStatement(SourceSpan location, TypedExpression expression) {
		super(location);
		this.expression = expression;
	}

	public TypedExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedExpressionStatement that = (TypedExpressionStatement) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}
}
