package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedPanic extends TypedExpression {

	private final TypedExpression message;

	public TypedPanic(SourceSpan location, TypedExpression message) {
		super(location);
		this.message = message;
	}

	public TypedExpression getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedPanic that = (TypedPanic) o;
		return Objects.equals(message, that.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(message);
	}
}
