package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

/**
 * An integer literal, holding its source text (which may use a base prefix or digit separators).
 */
public class TypedInt extends TypedExpression {

	private final String value;

	public TypedInt(SourceSpan location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
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
		TypedInt that = (TypedInt) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
