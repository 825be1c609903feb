package pygen.model.typed;

import pygen.util.SourceSpan;

/**
 * Base class of the type-checked AST handed to the backend. Equality ignores source locations.
 */
public abstract class TypedNode {

	private final SourceSpan location;

	public TypedNode(SourceSpan location) {
		this.location = location;
	}

	public SourceSpan getLocation() {
		return location;
	}

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();
}
