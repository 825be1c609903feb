package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedTuplePattern extends TypedPattern {

	private final List<TypedPattern> elements;

	public TypedTuplePattern(SourceSpan location, List<TypedPattern> elements) {
		super(location);
		this.elements = elements;
	}

	public List<TypedPattern> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedTuplePattern that = (TypedTuplePattern) o;
		return Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}
}
