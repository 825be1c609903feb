package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedBinOp extends TypedExpression {

	private final BinOp operator;
	private final TypedExpression left;
	private final TypedExpression right;

	public TypedBinOp(SourceSpan location, BinOp operator, TypedExpression left, TypedExpression right) {
		super(location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public BinOp getOperator() {
		return operator;
	}

	public TypedExpression getLeft() {
		return left;
	}

	public TypedExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedBinOp that = (TypedBinOp) o;
		return Objects.equals(operator, that.operator) &&
				Objects.equals(left, that.left) &&
				Objects.equals(right, that.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}
}
