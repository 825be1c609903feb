package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedConstructorPattern extends TypedPattern {

	private final String name;
	private final List<TypedPattern> arguments;

	public TypedConstructorPattern(SourceSpan location, String name, List<TypedPattern> arguments) {
		super(location);
		this.name = name;
		this.arguments = arguments;
	}

	public String getName() {
		return name;
	}

	public List<TypedPattern> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedConstructorPattern that = (TypedConstructorPattern) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}
}
