package pygen.trans.passes.codegen.python;

import pygen.model.doc.Document;
import pygen.model.typed.*;
import pygen.scope.ScopeTable;

import java.util.ArrayList;
import java.util.List;

import static pygen.model.doc.DocBuilder.*;

/**
 * Lowers an expression that is evaluated for its value. Statement level constructs (blocks, tail
 * calls) are handled by {@link StatementCodeGenVisitor} before an expression reaches this visitor.
 */
public class ExpressionCodeGenVisitor extends TypedExpressionVisitor<Document, UnsupportedFeatureIssue> {

	private static final String PRELUDE_MODULE = "gleam";

	private final FunctionContext function;
	private final ScopeTable scope;

	public ExpressionCodeGenVisitor(FunctionContext function, ScopeTable scope) {
		this.function = function;
		this.scope = scope;
	}

	private Document lower(TypedExpression expression) throws UnsupportedFeatureIssue {
		return expression.accept(this);
	}

	private static int precedence(TypedExpression expression) {
		return expression.accept(new ExpressionPrecedenceVisitor());
	}

	private Document lowerWrapped(TypedExpression expression, boolean parenthesize) throws UnsupportedFeatureIssue {
		Document document = lower(expression);
		if (parenthesize) {
			return document.surround("(", ")");
		}
		return document;
	}

	private Document lowerAll(List<TypedExpression> expressions) throws UnsupportedFeatureIssue {
		List<Document> documents = new ArrayList<>();
		for (TypedExpression expression : expressions) {
			documents.add(lower(expression));
		}
		return wrapArguments(documents, function.getIndent());
	}

	@Override
	public Document visit(TypedInt typedInt) throws UnsupportedFeatureIssue {
		return text(typedInt.getValue());
	}

	@Override
	public Document visit(TypedFloat typedFloat) throws UnsupportedFeatureIssue {
		return text(typedFloat.getValue());
	}

	@Override
	public Document visit(TypedString typedString) throws UnsupportedFeatureIssue {
		return text("\"" + typedString.getValue().replace("\n", "\\n") + "\"");
	}

	@Override
	public Document visit(TypedVar var) throws UnsupportedFeatureIssue {
		switch (var.getKind()) {
			case LOCAL_VARIABLE:
			case MODULE_FUNCTION:
			case MODULE_CONSTANT:
				return text(Identifiers.referenceVariable(scope, var.getName(), var.getLocation()));
			case RECORD:
				if (var.getModule() == null || var.getModule().equals(PRELUDE_MODULE)) {
					switch (var.getName()) {
						case "True":
							return text("True");
						case "False":
							return text("False");
						case "Nil":
							return text("None");
					}
				}
				throw new UnsupportedFeatureIssue("custom type constructor " + var.getName(), var.getLocation());
		}
		throw new UnsupportedFeatureIssue("value " + var.getName(), var.getLocation());
	}

	@Override
	public Document visit(TypedCall call) throws UnsupportedFeatureIssue {
		TypedExpression fun = call.getFun();
		boolean parenthesize = !(fun instanceof TypedVar || fun instanceof TypedModuleSelect || fun instanceof TypedCall);
		return lowerWrapped(fun, parenthesize).append(lowerAll(call.getArguments()));
	}

	@Override
	public Document visit(TypedBlock block) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("block used as a nested expression", block.getLocation());
	}

	@Override
	public Document visit(TypedTuple tuple) throws UnsupportedFeatureIssue {
		List<TypedExpression> elements = tuple.getElements();
		if (elements.size() == 1) {
			return lower(elements.get(0)).surround("(", ",)");
		}
		return lowerAll(elements);
	}

	@Override
	public Document visit(TypedTupleIndex tupleIndex) throws UnsupportedFeatureIssue {
		TypedExpression tuple = tupleIndex.getTuple();
		return lowerWrapped(tuple, precedence(tuple) < ExpressionPrecedenceVisitor.ATOM)
				.append("[" + tupleIndex.getIndex() + "]");
	}

	@Override
	public Document visit(TypedList typedList) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("list", typedList.getLocation());
	}

	@Override
	public Document visit(TypedBinOp binOp) throws UnsupportedFeatureIssue {
		String operator;
		switch (binOp.getOperator()) {
			case AND:
				operator = "and";
				break;
			case OR:
				operator = "or";
				break;
			case EQ:
				operator = "==";
				break;
			case NOT_EQ:
				operator = "!=";
				break;
			case LT_INT:
			case LT_FLOAT:
				operator = "<";
				break;
			case LT_EQ_INT:
			case LT_EQ_FLOAT:
				operator = "<=";
				break;
			case GT_INT:
			case GT_FLOAT:
				operator = ">";
				break;
			case GT_EQ_INT:
			case GT_EQ_FLOAT:
				operator = ">=";
				break;
			case ADD_INT:
			case ADD_FLOAT:
			case CONCATENATE:
				operator = "+";
				break;
			case SUB_INT:
			case SUB_FLOAT:
				operator = "-";
				break;
			case MULT_INT:
			case MULT_FLOAT:
				operator = "*";
				break;
			case DIV_INT:
				throw new UnsupportedFeatureIssue("integer division", binOp.getLocation());
			case DIV_FLOAT:
				throw new UnsupportedFeatureIssue("float division", binOp.getLocation());
			case REMAINDER_INT:
				throw new UnsupportedFeatureIssue("integer remainder", binOp.getLocation());
			default:
				throw new UnsupportedFeatureIssue("operator " + binOp.getOperator(), binOp.getLocation());
		}

		int parent = ExpressionPrecedenceVisitor.precedence(binOp.getOperator());
		int left = precedence(binOp.getLeft());
		int right = precedence(binOp.getRight());
		boolean comparison = parent == ExpressionPrecedenceVisitor.COMPARISON;
		Document leftDoc = lowerWrapped(binOp.getLeft(), left < parent || (comparison && left == parent));
		Document rightDoc = lowerWrapped(binOp.getRight(), right <= parent);
		return leftDoc.append(" " + operator + " ").append(rightDoc);
	}

	@Override
	public Document visit(TypedNegateBool negateBool) throws UnsupportedFeatureIssue {
		TypedExpression value = negateBool.getValue();
		return text("not ").append(lowerWrapped(value, value instanceof TypedBinOp));
	}

	@Override
	public Document visit(TypedNegateInt negateInt) throws UnsupportedFeatureIssue {
		TypedExpression value = negateInt.getValue();
		return text("-").append(lowerWrapped(value, value instanceof TypedBinOp));
	}

	@Override
	public Document visit(TypedModuleSelect moduleSelect) throws UnsupportedFeatureIssue {
		switch (moduleSelect.getKind()) {
			case MODULE_FUNCTION:
			case MODULE_CONSTANT:
				return text(Identifiers.maybeEscape(moduleSelect.getModuleAlias()) + "." +
						Identifiers.maybeEscape(moduleSelect.getLabel()));
			case RECORD:
				throw new UnsupportedFeatureIssue("custom type constructor " + moduleSelect.getModuleAlias() +
						"." + moduleSelect.getLabel(), moduleSelect.getLocation());
		}
		throw new UnsupportedFeatureIssue("qualified value " + moduleSelect.getModuleAlias() + "." +
				moduleSelect.getLabel(), moduleSelect.getLocation());
	}

	@Override
	public Document visit(TypedFn typedFn) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("anonymous function", typedFn.getLocation());
	}

	@Override
	public Document visit(TypedCase typedCase) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("case expression", typedCase.getLocation());
	}

	@Override
	public Document visit(TypedRecordAccess recordAccess) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("record access", recordAccess.getLocation());
	}

	@Override
	public Document visit(TypedTodo todo) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("todo", todo.getLocation());
	}

	@Override
	public Document visit(TypedPanic panic) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("panic", panic.getLocation());
	}
}
