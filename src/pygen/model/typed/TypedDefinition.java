package pygen.model.typed;

import pygen.util.SourceSpan;

public abstract class TypedDefinition extends TypedNode {

	public TypedDefinition(SourceSpan location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E;
}
