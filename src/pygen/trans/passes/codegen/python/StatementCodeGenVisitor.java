package pygen.trans.passes.codegen.python;

import pygen.InternalCompilerError;
import pygen.model.doc.Document;
import pygen.model.typed.*;
import pygen.scope.ScopeTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static pygen.model.doc.DocBuilder.*;

/**
 * Lowers a statement into the Python statements it expands to.
 *
 * Blocks are flattened into the enclosing statement list, so one statement may produce several
 * lines. In tail position the value of a statement is returned, unless it is a call of the
 * enclosing function, which becomes a jump back to the top of the function's loop.
 */
public class StatementCodeGenVisitor extends TypedStatementVisitor<List<Document>, UnsupportedFeatureIssue> {

	private final FunctionContext function;
	private final ScopeTable scope;
	private final Position position;

	public StatementCodeGenVisitor(FunctionContext function, ScopeTable scope, Position position) {
		this.function = function;
		this.scope = scope;
		this.position = position;
	}

	/**
	 * Lowers a statement sequence whose last statement is in the given position.
	 */
	public static List<Document> lowerStatements(FunctionContext function, ScopeTable scope,
	                                             List<TypedStatement> statements, Position position) {
		List<Document> result = new ArrayList<>();
		for (int i = 0; i < statements.size(); i++) {
			Position statementPosition = i == statements.size() - 1 ? position : Position.NOT_TAIL;
			result.addAll(statements.get(i).accept(new StatementCodeGenVisitor(function, scope, statementPosition)));
		}
		return result;
	}

	private Document lowerExpression(TypedExpression expression, ScopeTable expressionScope) {
		return expression.accept(new ExpressionCodeGenVisitor(function, expressionScope));
	}

	private static List<TypedStatement> blockStatements(TypedBlock block) {
		if (block.getStatements().isEmpty()) {
			throw new InternalCompilerError("empty block");
		}
		return block.getStatements();
	}

	private List<Document> lowerValue(TypedExpression expression) throws UnsupportedFeatureIssue {
		if (expression instanceof TypedBlock) {
			return lowerStatements(function, scope.child(), blockStatements((TypedBlock) expression), position);
		}
		if (position.isTail() && function.isSelfCall(expression)) {
			return lowerTailCall((TypedCall) expression);
		}
		Document document = lowerExpression(expression, scope);
		if (position.isTail()) {
			return Collections.singletonList(text("return ").append(document));
		}
		return Collections.singletonList(document);
	}

	private List<Document> lowerTailCall(TypedCall call) throws UnsupportedFeatureIssue {
		List<TypedArg> parameters = function.getArguments();
		List<TypedExpression> arguments = call.getArguments();
		if (parameters.size() != arguments.size()) {
			throw new InternalCompilerError("call of " + function.getFunctionName() + " with " +
					arguments.size() + " arguments, expected " + parameters.size());
		}
		function.setTailRecursionUsed();
		List<Document> result = new ArrayList<>();
		for (int i = 0; i < arguments.size(); i++) {
			Document value = lowerExpression(arguments.get(i), scope);
			String name = parameters.get(i).getName();
			if (name == null) {
				result.add(value);
			} else {
				result.add(text(Identifiers.loopVariableName(name) + " = ").append(value));
			}
		}
		result.add(text("continue"));
		return result;
	}

	// the value is lowered in valueScope, which a flattened block extends, while the pattern binds in scope
	private List<Document> lowerAssignment(TypedPattern pattern, TypedExpression value, ScopeTable valueScope)
			throws UnsupportedFeatureIssue {
		if (value instanceof TypedBlock) {
			List<TypedStatement> statements = blockStatements((TypedBlock) value);
			ScopeTable blockScope = valueScope.child();
			List<Document> result = new ArrayList<>(lowerStatements(
					function, blockScope, statements.subList(0, statements.size() - 1), Position.NOT_TAIL));
			TypedStatement last = statements.get(statements.size() - 1);
			if (last instanceof TypedUse) {
				throw new UnsupportedFeatureIssue("use expression", last.getLocation());
			}
			if (!(last instanceof TypedExpressionStatement)) {
				throw new UnsupportedFeatureIssue("block ending in an assignment used as a value",
						last.getLocation());
			}
			result.addAll(lowerAssignment(pattern, ((TypedExpressionStatement) last).getExpression(), blockScope));
			return result;
		}
		Document valueDoc = lowerExpression(value, valueScope);
		Document target = pattern.accept(new PatternCodeGenVisitor(scope, function.getIndent()));
		return Collections.singletonList(target.append(" = ").append(valueDoc));
	}

	@Override
	public List<Document> visit(TypedExpressionStatement expressionStatement) throws UnsupportedFeatureIssue {
		return lowerValue(expressionStatement.getExpression());
	}

	@Override
	public List<Document> visit(TypedAssignment assignment) throws UnsupportedFeatureIssue {
		if (assignment.getKind() == TypedAssignment.Kind.ASSERT) {
			throw new UnsupportedFeatureIssue("let assert", assignment.getLocation());
		}
		if (position.isTail()) {
			return lowerValue(assignment.getValue());
		}
		return lowerAssignment(assignment.getPattern(), assignment.getValue(), scope);
	}

	@Override
	public List<Document> visit(TypedUse typedUse) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("use expression", typedUse.getLocation());
	}
}
