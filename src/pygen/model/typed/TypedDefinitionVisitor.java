package pygen.model.typed;

public abstract class TypedDefinitionVisitor<T, E extends Throwable> {
	public abstract T visit(TypedImport typedImport) throws E;
	public abstract T visit(TypedCustomType customType) throws E;
	public abstract T visit(TypedTypeAlias typeAlias) throws E;
	public abstract T visit(TypedModuleConstant moduleConstant) throws E;
	public abstract T visit(TypedFunction function) throws E;
}
