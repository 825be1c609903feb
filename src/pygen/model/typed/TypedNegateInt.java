package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedNegateInt extends TypedExpression {

	private final TypedExpression value;

	public TypedNegateInt(SourceSpan location, TypedExpression value) {
		super(location);
		this.value = value;
	}

	public TypedExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedNegateInt that = (TypedNegateInt) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
