package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class TypedBuilder {
	private TypedBuilder() {}

	public static final Set<Target> ALL_TARGETS = Collections.unmodifiableSet(EnumSet.allOf(Target.class));

	public static TypedModule module(String name, TypedDefinition... definitions) {
		return new TypedModule(name, Arrays.asList(definitions));
	}

	public static TypedImport importModule(String module) {
		return new TypedImport(SourceSpan.unknown(), module, null, Collections.emptyList());
	}

	public static TypedImport importAs(String module, String alias) {
		return new TypedImport(SourceSpan.unknown(), module,
				new TypedImportAlias(TypedImportAlias.Kind.NAMED, alias), Collections.emptyList());
	}

	public static TypedImport importDiscard(String module, String discard) {
		return new TypedImport(SourceSpan.unknown(), module,
				new TypedImportAlias(TypedImportAlias.Kind.DISCARD, discard), Collections.emptyList());
	}

	public static TypedImport importUnqualified(String module, TypedUnqualifiedImport... members) {
		return new TypedImport(SourceSpan.unknown(), module, null, Arrays.asList(members));
	}

	public static TypedUnqualifiedImport unqualified(String name) {
		return new TypedUnqualifiedImport(SourceSpan.unknown(), name, null, false);
	}

	public static TypedUnqualifiedImport unqualifiedAs(String name, String alias) {
		return new TypedUnqualifiedImport(SourceSpan.unknown(), name, alias, false);
	}

	public static TypedUnqualifiedImport unqualifiedType(String name) {
		return new TypedUnqualifiedImport(SourceSpan.unknown(), name, null, true);
	}

	public static TypedCustomType customType(String name) {
		return new TypedCustomType(SourceSpan.unknown(), Publicity.PUBLIC, name);
	}

	public static TypedTypeAlias typeAlias(String alias) {
		return new TypedTypeAlias(SourceSpan.unknown(), Publicity.PUBLIC, alias);
	}

	public static TypedModuleConstant constant(String name, TypedExpression value) {
		return new TypedModuleConstant(SourceSpan.unknown(), Publicity.PUBLIC, name, value);
	}

	public static TypedFunction function(String name, List<TypedArg> arguments, TypedStatement... body) {
		return new TypedFunction(SourceSpan.unknown(), name, Publicity.PRIVATE, arguments, Arrays.asList(body),
				null, ALL_TARGETS);
	}

	public static TypedFunction publicFunction(String name, List<TypedArg> arguments, TypedStatement... body) {
		return new TypedFunction(SourceSpan.unknown(), name, Publicity.PUBLIC, arguments, Arrays.asList(body),
				null, ALL_TARGETS);
	}

	public static TypedFunction targetedFunction(Set<Target> targets, String name, List<TypedArg> arguments,
	                                             TypedStatement... body) {
		return new TypedFunction(SourceSpan.unknown(), name, Publicity.PUBLIC, arguments, Arrays.asList(body),
				null, targets);
	}

	public static TypedFunction externalFunction(String name, List<TypedArg> arguments, String module,
	                                             String function) {
		return new TypedFunction(SourceSpan.unknown(), name, Publicity.PUBLIC, arguments,
				Collections.singletonList(expr(todo())), new TypedExternal(module, function), ALL_TARGETS);
	}

	public static List<TypedArg> args(TypedArg... arguments) {
		return Arrays.asList(arguments);
	}

	public static List<TypedArg> params(String... names) {
		TypedArg[] arguments = new TypedArg[names.length];
		for (int i = 0; i < names.length; i++) {
			arguments[i] = arg(names[i]);
		}
		return Arrays.asList(arguments);
	}

	public static TypedArg arg(String name) {
		return new TypedArg(SourceSpan.unknown(), name);
	}

	public static TypedArg discardArg() {
		return new TypedArg(SourceSpan.unknown(), null);
	}

	public static TypedExpressionStatement expr(TypedExpression expression) {
		return new TypedExpressionStatement(expression.getLocation(), expression);
	}

	public static TypedAssignment let(TypedPattern pattern, TypedExpression value) {
		return new TypedAssignment(SourceSpan.unknown(), TypedAssignment.Kind.LET, pattern, value);
	}

	public static TypedAssignment let(String name, TypedExpression value) {
		return let(pVar(name), value);
	}

	public static TypedAssignment letAssert(TypedPattern pattern, TypedExpression value) {
		return new TypedAssignment(SourceSpan.unknown(), TypedAssignment.Kind.ASSERT, pattern, value);
	}

	public static TypedUse use(List<String> names, TypedExpression call) {
		return new TypedUse(SourceSpan.unknown(), names, call);
	}

	public static TypedVariablePattern pVar(String name) {
		return new TypedVariablePattern(SourceSpan.unknown(), name);
	}

	public static TypedDiscardPattern pDiscard(String name) {
		return new TypedDiscardPattern(SourceSpan.unknown(), name);
	}

	public static TypedTuplePattern pTuple(TypedPattern... elements) {
		return new TypedTuplePattern(SourceSpan.unknown(), Arrays.asList(elements));
	}

	public static TypedConstructorPattern pConstructor(String name, TypedPattern... arguments) {
		return new TypedConstructorPattern(SourceSpan.unknown(), name, Arrays.asList(arguments));
	}

	public static TypedInt num(String value) {
		return new TypedInt(SourceSpan.unknown(), value);
	}

	public static TypedInt num(long value) {
		return num(Long.toString(value));
	}

	public static TypedFloat flt(String value) {
		return new TypedFloat(SourceSpan.unknown(), value);
	}

	public static TypedString str(String value) {
		return new TypedString(SourceSpan.unknown(), value);
	}

	public static TypedVar local(String name) {
		return new TypedVar(SourceSpan.unknown(), name, ValueConstructorKind.LOCAL_VARIABLE, null);
	}

	public static TypedVar moduleFn(String module, String name) {
		return new TypedVar(SourceSpan.unknown(), name, ValueConstructorKind.MODULE_FUNCTION, module);
	}

	public static TypedVar moduleConst(String module, String name) {
		return new TypedVar(SourceSpan.unknown(), name, ValueConstructorKind.MODULE_CONSTANT, module);
	}

	public static TypedVar record(String module, String name) {
		return new TypedVar(SourceSpan.unknown(), name, ValueConstructorKind.RECORD, module);
	}

	public static TypedCall call(TypedExpression fun, TypedExpression... arguments) {
		return new TypedCall(SourceSpan.unknown(), fun, Arrays.asList(arguments));
	}

	public static TypedBlock block(TypedStatement... statements) {
		return new TypedBlock(SourceSpan.unknown(), Arrays.asList(statements));
	}

	public static TypedTuple tuple(TypedExpression... elements) {
		return new TypedTuple(SourceSpan.unknown(), Arrays.asList(elements));
	}

	public static TypedTupleIndex tupleIndex(TypedExpression tuple, int index) {
		return new TypedTupleIndex(SourceSpan.unknown(), tuple, index);
	}

	public static TypedList list(TypedExpression... elements) {
		return new TypedList(SourceSpan.unknown(), Arrays.asList(elements), null);
	}

	public static TypedBinOp binop(BinOp operator, TypedExpression left, TypedExpression right) {
		return new TypedBinOp(SourceSpan.unknown(), operator, left, right);
	}

	public static TypedNegateBool negateBool(TypedExpression value) {
		return new TypedNegateBool(SourceSpan.unknown(), value);
	}

	public static TypedNegateInt negateInt(TypedExpression value) {
		return new TypedNegateInt(SourceSpan.unknown(), value);
	}

	public static TypedModuleSelect select(String moduleName, String moduleAlias, String label) {
		return new TypedModuleSelect(SourceSpan.unknown(), moduleName, moduleAlias, label,
				ValueConstructorKind.MODULE_FUNCTION);
	}

	public static TypedFn fn(List<TypedArg> arguments, TypedStatement... body) {
		return new TypedFn(SourceSpan.unknown(), arguments, Arrays.asList(body));
	}

	public static TypedCase caseOf(List<TypedExpression> subjects, TypedClause... clauses) {
		return new TypedCase(SourceSpan.unknown(), subjects, Arrays.asList(clauses));
	}

	public static TypedClause clause(List<TypedPattern> patterns, TypedExpression then) {
		return new TypedClause(SourceSpan.unknown(), patterns, then);
	}

	public static TypedRecordAccess recordAccess(TypedExpression record, String label, int index) {
		return new TypedRecordAccess(SourceSpan.unknown(), record, label, index);
	}

	public static TypedTodo todo() {
		return new TypedTodo(SourceSpan.unknown(), null);
	}

	public static TypedPanic panic() {
		return new TypedPanic(SourceSpan.unknown(), null);
	}
}
