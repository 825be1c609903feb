package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedClause extends TypedNode {

	private final List<TypedPattern> patterns;
	private final TypedExpression then;

	public TypedClause(SourceSpan location, List<TypedPattern> patterns, TypedExpression then) {
		super(location);
		this.patterns = patterns;
		this.then = then;
	}

	public List<TypedPattern> getPatterns() {
		return patterns;
	}

	public TypedExpression getThen() {
		return then;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedClause that = (TypedClause) o;
		return Objects.equals(patterns, that.patterns) &&
				Objects.equals(then, that.then);
	}

	@Override
	public int hashCode() {
		return Objects.hash(patterns, then);
	}
}
