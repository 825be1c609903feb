package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedCase extends TypedExpression {

	private final List<TypedExpression> subjects;
	private final List<TypedClause> clauses;

	public TypedCase(SourceSpan location, List<TypedExpression> subjects, List<TypedClause> clauses) {
		super(location);
		this.subjects = subjects;
		this.clauses = clauses;
	}

	public List<TypedExpression> getSubjects() {
		return subjects;
	}

	public List<TypedClause> getClauses() {
		return clauses;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedCase that = (TypedCase) o;
		return Objects.equals(subjects, that.subjects) &&
				Objects.equals(clauses, that.clauses);
	}

	@Override
	public int hashCode() {
		return Objects.hash(subjects, clauses);
	}
}
