package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedTupleIndex extends TypedExpression {

	private final TypedExpression tuple;
	private final int index;

	public TypedTupleIndex(SourceSpan location, TypedExpression tuple, int index) {
		super(location);
		this.tuple = tuple;
		this.index = index;
	}

	public TypedExpression getTuple() {
		return tuple;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedTupleIndex that = (TypedTupleIndex) o;
		return Objects.equals(tuple, that.tuple) &&
				index == that.index;
	}

	@Override
	public int hashCode() {
		return Objects.hash(tuple, index);
	}
}
