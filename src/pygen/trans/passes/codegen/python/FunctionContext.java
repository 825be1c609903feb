package pygen.trans.passes.codegen.python;

import pygen.model.typed.TypedArg;
import pygen.model.typed.TypedCall;
import pygen.model.typed.TypedExpression;
import pygen.model.typed.TypedVar;
import pygen.model.typed.ValueConstructorKind;

import java.util.Collections;
import java.util.List;

/**
 * What the lowering of one function body (or module constant) needs to know about its surroundings.
 */
public class FunctionContext {

	private final String moduleName;
	private final String functionName;
	private final List<TypedArg> arguments;
	private final int indent;
	private boolean tailRecursionUsed = false;

	/**
	 * @param functionName the name tail calls may target, or null when no call can be rewritten into
	 *                     a loop (the name is shadowed by a parameter, or there is no enclosing function)
	 */
	public FunctionContext(String moduleName, String functionName, List<TypedArg> arguments, int indent) {
		this.moduleName = moduleName;
		this.functionName = functionName;
		this.arguments = arguments;
		this.indent = indent;
	}

	public static FunctionContext forConstant(String moduleName, int indent) {
		return new FunctionContext(moduleName, null, Collections.emptyList(), indent);
	}

	public String getModuleName() {
		return moduleName;
	}

	public String getFunctionName() {
		return functionName;
	}

	public List<TypedArg> getArguments() {
		return arguments;
	}

	public int getIndent() {
		return indent;
	}

	public boolean isTailRecursionUsed() {
		return tailRecursionUsed;
	}

	public void setTailRecursionUsed() {
		tailRecursionUsed = true;
	}

	public boolean isSelfCall(TypedExpression expression) {
		if (functionName == null || !(expression instanceof TypedCall)) {
			return false;
		}
		TypedExpression fun = ((TypedCall) expression).getFun();
		if (!(fun instanceof TypedVar)) {
			return false;
		}
		TypedVar var = (TypedVar) fun;
		return var.getKind() == ValueConstructorKind.MODULE_FUNCTION &&
				moduleName.equals(var.getModule()) &&
				functionName.equals(var.getName());
	}
}
