package pygen.trans.passes.codegen.python;

import pygen.Unreachable;
import pygen.model.typed.*;

/**
 * The binding strength of the Python rendering of an expression, higher binding tighter.
 */
public class ExpressionPrecedenceVisitor extends TypedExpressionVisitor<Integer, RuntimeException> {

	public static final int OR = 1;
	public static final int AND = 2;
	public static final int NOT = 3;
	public static final int COMPARISON = 4;
	public static final int ADDITIVE = 5;
	public static final int MULTIPLICATIVE = 6;
	public static final int UNARY = 7;
	public static final int ATOM = 8;

	public static int precedence(BinOp operator) {
		switch (operator) {
			case OR:
				return OR;
			case AND:
				return AND;
			case EQ:
			case NOT_EQ:
			case LT_INT:
			case LT_EQ_INT:
			case LT_FLOAT:
			case LT_EQ_FLOAT:
			case GT_EQ_INT:
			case GT_INT:
			case GT_EQ_FLOAT:
			case GT_FLOAT:
				return COMPARISON;
			case ADD_INT:
			case ADD_FLOAT:
			case SUB_INT:
			case SUB_FLOAT:
			case CONCATENATE:
				return ADDITIVE;
			case MULT_INT:
			case MULT_FLOAT:
			case DIV_INT:
			case DIV_FLOAT:
			case REMAINDER_INT:
				return MULTIPLICATIVE;
		}
		throw new Unreachable();
	}

	@Override
	public Integer visit(TypedInt typedInt) throws RuntimeException {
		// -1 renders with its sign, so it binds like a negation
		return typedInt.getValue().startsWith("-") ? UNARY : ATOM;
	}

	@Override
	public Integer visit(TypedFloat typedFloat) throws RuntimeException {
		return typedFloat.getValue().startsWith("-") ? UNARY : ATOM;
	}

	@Override
	public Integer visit(TypedString typedString) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedVar var) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedCall call) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedBlock block) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedTuple tuple) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedTupleIndex tupleIndex) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedList typedList) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedBinOp binOp) throws RuntimeException {
		return precedence(binOp.getOperator());
	}

	@Override
	public Integer visit(TypedNegateBool negateBool) throws RuntimeException {
		return NOT;
	}

	@Override
	public Integer visit(TypedNegateInt negateInt) throws RuntimeException {
		return UNARY;
	}

	@Override
	public Integer visit(TypedModuleSelect moduleSelect) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedFn typedFn) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedCase typedCase) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedRecordAccess recordAccess) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedTodo todo) throws RuntimeException {
		return ATOM;
	}

	@Override
	public Integer visit(TypedPanic panic) throws RuntimeException {
		return ATOM;
	}
}
