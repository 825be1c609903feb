package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

/**
 * A function parameter. A null name denotes a discarded parameter.
 */
public class TypedArg extends TypedNode {

	private final String name;

	public TypedArg(SourceSpan location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedArg that = (TypedArg) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
