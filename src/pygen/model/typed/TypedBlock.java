package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedBlock extends TypedExpression {

	private final List<TypedStatement> statements;

	public TypedBlock(SourceSpan location, List<TypedStatement> statements) {
		super(location);
		this.statements = statements;
	}

	public List<TypedStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedBlock that = (TypedBlock) o;
		return Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}
}
