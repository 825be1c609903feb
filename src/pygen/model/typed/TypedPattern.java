package pygen.model.typed;

import pygen.util.SourceSpan;

public abstract class TypedPattern extends TypedNode {

	public TypedPattern(SourceSpan location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(TypedPatternVisitor<T, E> v) throws E;
}
