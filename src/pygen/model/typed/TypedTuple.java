package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedTuple extends TypedExpression {

	private final List<TypedExpression> elements;

	public TypedTuple(SourceSpan location, List<TypedExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<TypedExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedTuple that = (TypedTuple) o;
		return Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}
}
