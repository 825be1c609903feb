package pygen.model.typed;

import pygen.util.SourceSpan;

public abstract class TypedStatement extends TypedNode {

	public TypedStatement(SourceSpan location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(TypedStatementVisitor<T, E> v) throws E;
}
