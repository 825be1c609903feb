package pygen.trans.passes.codegen.python;

import pygen.InternalCompilerError;
import pygen.model.doc.Document;
import pygen.model.typed.*;
import pygen.scope.ScopeTable;
import pygen.trans.TargetSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static pygen.model.doc.DocBuilder.*;

/**
 * Lowers the definitions of a module that produce Python code: functions implemented in the source
 * language for Python, and module constants. The results are collected separately, so constants
 * can be written after every function they may refer to.
 */
public class DefinitionCodeGenVisitor extends TypedDefinitionVisitor<Void, RuntimeException> {

	private static final Logger logger = Logger.getLogger("PyGen CodeGen");

	private final String moduleName;
	private final ScopeTable moduleScope;
	private final TargetSupport targetSupport;
	private final int indent;
	private final List<Document> functions = new ArrayList<>();
	private final List<Document> constants = new ArrayList<>();

	public DefinitionCodeGenVisitor(String moduleName, ScopeTable moduleScope, TargetSupport targetSupport,
	                                int indent) {
		this.moduleName = moduleName;
		this.moduleScope = moduleScope;
		this.targetSupport = targetSupport;
		this.indent = indent;
	}

	public List<Document> getFunctions() {
		return Collections.unmodifiableList(functions);
	}

	public List<Document> getConstants() {
		return Collections.unmodifiableList(constants);
	}

	private void skipOrPropagate(String definition, UnsupportedFeatureIssue issue) {
		if (targetSupport.isEnforced()) {
			throw issue;
		}
		logger.fine("omitting " + definition + " from module " + moduleName +
				": unsupported feature " + issue.getFeature());
	}

	@Override
	public Void visit(TypedImport typedImport) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TypedCustomType customType) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TypedTypeAlias typeAlias) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TypedModuleConstant moduleConstant) throws RuntimeException {
		FunctionContext context = FunctionContext.forConstant(moduleName, indent);
		try {
			Document value = moduleConstant.getValue().accept(new ExpressionCodeGenVisitor(context, moduleScope.child()));
			constants.add(text(Identifiers.maybeEscape(moduleConstant.getName()) + " = ").append(value));
		} catch (UnsupportedFeatureIssue issue) {
			skipOrPropagate("constant " + moduleConstant.getName(), issue);
		}
		return null;
	}

	@Override
	public Void visit(TypedFunction function) throws RuntimeException {
		if (function.getExternalPython() != null || !function.supports(Target.PYTHON)) {
			return null;
		}
		if (function.getName() == null) {
			throw new InternalCompilerError("module function without a name");
		}
		try {
			functions.add(lowerFunction(function));
		} catch (UnsupportedFeatureIssue issue) {
			skipOrPropagate("function " + function.getName(), issue);
		}
		return null;
	}

	private Document lowerFunction(TypedFunction function) throws UnsupportedFeatureIssue {
		List<String> parameterNames = new ArrayList<>();
		for (TypedArg argument : function.getArguments()) {
			if (argument.getName() != null) {
				parameterNames.add(argument.getName());
			}
		}
		ScopeTable scope = moduleScope.withParameters(parameterNames);
		for (TypedArg argument : function.getArguments()) {
			if (argument.getName() != null) {
				Identifiers.referenceVariable(scope, argument.getName(), argument.getLocation());
			}
		}

		// a parameter shadowing the function's name makes every call of that name a call of the parameter
		String selfName = parameterNames.contains(function.getName()) ? null : function.getName();
		FunctionContext context = new FunctionContext(moduleName, selfName, function.getArguments(), indent);
		List<Document> body = StatementCodeGenVisitor.lowerStatements(
				context, scope, function.getBody(), Position.TAIL);
		if (body.isEmpty()) {
			body = Collections.singletonList(text("pass"));
		}

		boolean loop = context.isTailRecursionUsed();
		List<Document> parameters = new ArrayList<>();
		List<Document> loopAssignments = new ArrayList<>();
		int discards = 0;
		for (TypedArg argument : function.getArguments()) {
			String name = argument.getName();
			if (name == null) {
				parameters.add(text(discards == 0 ? "_" : "_" + discards));
				discards++;
			} else if (loop) {
				parameters.add(text(Identifiers.loopVariableName(name)));
				loopAssignments.add(text(Identifiers.variableName(name, 0) + " = " +
						Identifiers.loopVariableName(name)));
			} else {
				parameters.add(text(Identifiers.variableName(name, 0)));
			}
		}

		Document bodyDoc = join(body, line());
		if (loop) {
			List<Document> loopBody = new ArrayList<>(loopAssignments);
			loopBody.addAll(body);
			bodyDoc = text("while True:").append(concat(line(), join(loopBody, line())).nest(indent));
		}
		return text("def " + Identifiers.maybeEscape(function.getName()))
				.append(wrapArguments(parameters, indent))
				.append(":")
				.append(concat(line(), bodyDoc).nest(indent));
	}
}
