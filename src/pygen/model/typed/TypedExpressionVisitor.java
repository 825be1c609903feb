package pygen.model.typed;

public abstract class TypedExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(TypedInt typedInt) throws E;
	public abstract T visit(TypedFloat typedFloat) throws E;
	public abstract T visit(TypedString typedString) throws E;
	public abstract T visit(TypedVar var) throws E;
	public abstract T visit(TypedCall call) throws E;
	public abstract T visit(TypedBlock block) throws E;
	public abstract T visit(TypedTuple tuple) throws E;
	public abstract T visit(TypedTupleIndex tupleIndex) throws E;
	public abstract T visit(TypedList typedList) throws E;
	public abstract T visit(TypedBinOp binOp) throws E;
	public abstract T visit(TypedNegateBool negateBool) throws E;
	public abstract T visit(TypedNegateInt negateInt) throws E;
	public abstract T visit(TypedModuleSelect moduleSelect) throws E;
	public abstract T visit(TypedFn typedFn) throws E;
	public abstract T visit(TypedCase typedCase) throws E;
	public abstract T visit(TypedRecordAccess recordAccess) throws E;
	public abstract T visit(TypedTodo todo) throws E;
	public abstract T visit(TypedPanic panic) throws E;
}
