package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedRecordAccess extends TypedExpression {

	private final TypedExpression record;
	private final String label;
	private final int index;

	public TypedRecordAccess(SourceSpan location, TypedExpression record, String label, int index) {
		super(location);
		this.record = record;
		this.label = label;
		this.index = index;
	}

	public TypedExpression getRecord() {
		return record;
	}

	public String getLabel() {
		return label;
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
		TypedRecordAccess that = (TypedRecordAccess) o;
		return Objects.equals(record, that.record) &&
				Objects.equals(label, that.label) &&
				index == that.index;
	}

	@Override
	public int hashCode() {
		return Objects.hash(record, label, index);
	}
}
