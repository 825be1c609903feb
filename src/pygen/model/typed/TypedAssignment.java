package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedAssignment extends TypedStatement {

	public enum Kind {
		LET,
		ASSERT,
	}

	private final Kind kind;
	private final TypedPattern pattern;
	private final TypedExpression value;

	public TypedAssignment(SourceSpan location, Kind kind, TypedPattern pattern, TypedExpression value) {
		super(location);
		this.kind = kind;
		this.pattern = pattern;
		this.value = value;
	}

	public Kind getKind() {
		return kind;
	}

	public TypedPattern getPattern() {
		return pattern;
	}

	public TypedExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedAssignment that = (TypedAssignment) o;
		return Objects.equals(kind, that.kind) &&
				Objects.equals(pattern, that.pattern) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, pattern, value);
	}
}
