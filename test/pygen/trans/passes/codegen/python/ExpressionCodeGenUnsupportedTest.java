package pygen.trans.passes.codegen.python;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pygen.model.typed.BinOp;
import pygen.model.typed.TypedExpression;
import pygen.model.typed.TypedModuleSelect;
import pygen.model.typed.ValueConstructorKind;
import pygen.scope.ScopeTable;
import pygen.util.SourceSpan;

import static pygen.model.typed.TypedBuilder.*;

@RunWith(Parameterized.class)
public class ExpressionCodeGenUnsupportedTest {

	@Parameters
	public static List<Object[]> testCases() {
		return Arrays.asList(new Object[][] {
				{list(num(1)), "list"},
				{fn(params("x"), expr(local("x"))), "anonymous function"},
				{caseOf(Collections.singletonList(local("x")),
						clause(Collections.singletonList(pDiscard("_")), num(1))), "case expression"},
				{recordAccess(local("cat"), "name", 0), "record access"},
				{todo(), "todo"},
				{panic(), "panic"},
				{binop(BinOp.DIV_INT, num(1), num(2)), "integer division"},
				{binop(BinOp.DIV_FLOAT, flt("1.0"), flt("2.0")), "float division"},
				{binop(BinOp.REMAINDER_INT, num(1), num(2)), "integer remainder"},
				{record("app", "Cat"), "custom type constructor Cat"},
				{new TypedModuleSelect(SourceSpan.unknown(), "pets", "pets", "Cat", ValueConstructorKind.RECORD),
						"custom type constructor pets.Cat"},
				{call(moduleFn("app", "f"), block(expr(num(1)))), "block used as a nested expression"},
				{tuple(num(1), binop(BinOp.ADD_INT, num(1), todo())), "todo"},
		});
	}

	private final TypedExpression expression;
	private final String feature;

	public ExpressionCodeGenUnsupportedTest(TypedExpression expression, String feature) {
		this.expression = expression;
		this.feature = feature;
	}

	@Test
	public void test() {
		ExpressionCodeGenVisitor visitor = new ExpressionCodeGenVisitor(
				FunctionContext.forConstant("app", 4), new ScopeTable());
		try {
			expression.accept(visitor);
			fail("expected " + feature + " to be unsupported");
		} catch (UnsupportedFeatureIssue issue) {
			assertThat(issue.getFeature(), is(feature));
		}
	}

}
