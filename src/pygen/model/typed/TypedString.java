package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

/**
 * A string literal. The value is the text between the quotes, with escape sequences as written.
 */
public class TypedString extends TypedExpression {

	private final String value;

	public TypedString(SourceSpan location, String value) {
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
		TypedString that = (TypedString) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
