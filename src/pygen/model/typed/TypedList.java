package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedList extends TypedExpression {

	private final List<TypedExpression> elements;
	private final TypedExpression tail;

	public TypedList(SourceSpan location, List<TypedExpression> elements, TypedExpression tail) {
		super(location);
		this.elements = elements;
		this.tail = tail;
	}

	public List<TypedExpression> getElements() {
		return elements;
	}

	public TypedExpression getTail() {
		return tail;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedList that = (TypedList) o;
		return Objects.equals(elements, that.elements) &&
				Objects.equals(tail, that.tail);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements, tail);
	}
}
