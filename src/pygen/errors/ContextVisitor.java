package pygen.errors;

import pygen.trans.passes.codegen.python.GeneratingModule;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(GeneratingModule generatingModule) throws E;

}
