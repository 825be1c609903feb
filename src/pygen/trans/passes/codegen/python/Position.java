package pygen.trans.passes.codegen.python;

/**
 * Whether the value of a statement becomes the return value of the enclosing function.
 */
public enum Position {
	TAIL,
	NOT_TAIL;

	public boolean isTail() {
		return this == TAIL;
	}
}
