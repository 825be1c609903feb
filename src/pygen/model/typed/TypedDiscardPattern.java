package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedDiscardPattern extends TypedPattern {

	private final String name;

	public TypedDiscardPattern(SourceSpan location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedDiscardPattern that = (TypedDiscardPattern) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
