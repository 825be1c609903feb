package pygen.trans.passes.codegen.python;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pygen.PyGenOptions;
import pygen.model.typed.BinOp;
import pygen.model.typed.TypedModule;
import pygen.util.LineNumbers;

import static pygen.model.typed.TypedBuilder.*;

@RunWith(Parameterized.class)
public class PythonCodeGenPassTest {

	@Parameters
	public static List<Object[]> testCases() {
		return Arrays.asList(new Object[][] {
				{
						module("app"),
						"",
				},
				// import a/b.{c}
				// fn f() { c() }
				{
						module("app",
								importUnqualified("a/b", unqualified("c")),
								function("f", params(), expr(call(moduleFn("a/b", "c"))))),
						"from a.b import (c)\n" +
								"\n" +
								"def f():\n" +
								"    return c()\n",
				},
				{
						module("app",
								importModule("zeta"),
								importAs("gleam", "g"),
								importModule("a/b"),
								importDiscard("io", "_io")),
						"import gleam as g\n" +
								"from a import (b)\n" +
								"import zeta\n",
				},
				{
						module("app",
								customType("Cat"),
								typeAlias("Cats"),
								importUnqualified("pets", unqualifiedType("Dog")),
								function("main", params(), expr(num(1)))),
						"def main():\n" +
								"    return 1\n",
				},
				{
						module("app",
								importUnqualified("x/y", unqualified("len")),
								externalFunction("size", params("s"), "x/y", "len"),
								externalFunction("count", params("s"), "x.y", "count"),
								externalFunction("class", params("s"), "x/y", "klass")),
						"from x.y import (len, len as size, count, klass as class_)\n",
				},
				{
						module("app",
								importUnqualified("some/long/module/path",
										unqualified("alpha_function"),
										unqualified("beta_function"),
										unqualified("gamma_function"),
										unqualified("delta_function"),
										unqualified("epsilon_function"))),
						"from some.long.module.path import (\n" +
								"    alpha_function,\n" +
								"    beta_function,\n" +
								"    gamma_function,\n" +
								"    delta_function,\n" +
								"    epsilon_function,\n" +
								")\n",
				},
				// fn go(n, acc, _) { go(n - 1, acc + n, 0) }
				{
						module("app",
								function("go", args(arg("n"), arg("acc"), discardArg()),
										expr(call(moduleFn("app", "go"),
												binop(BinOp.SUB_INT, local("n"), num(1)),
												binop(BinOp.ADD_INT, local("acc"), local("n")),
												num(0))))),
						"def go(loop$n, loop$acc, _):\n" +
								"    while True:\n" +
								"        n = loop$n\n" +
								"        acc = loop$acc\n" +
								"        loop$n = n - 1\n" +
								"        loop$acc = acc + n\n" +
								"        0\n" +
								"        continue\n",
				},
				// fn f(f) { f(f) }
				{
						module("app",
								function("f", params("f"), expr(call(moduleFn("app", "f"), local("f"))))),
						"def f(f):\n" +
								"    return f(f)\n",
				},
				// a call of the function that is not in tail position stays a call
				{
						module("app",
								function("f", params("n"),
										let("m", call(moduleFn("app", "f"), local("n"))),
										expr(local("m")))),
						"def f(n):\n" +
								"    m = f(n)\n" +
								"    return m\n",
				},
				{
						module("app",
								function("f", params("x"),
										let("x", binop(BinOp.ADD_INT, local("x"), num(1))),
										let("x", binop(BinOp.MULT_INT, local("x"), num(2))),
										expr(local("x")))),
						"def f(x):\n" +
								"    x$1 = x + 1\n" +
								"    x$2 = x$1 * 2\n" +
								"    return x$2\n",
				},
				// let y = { let z = 1 z + 2 }
				{
						module("app",
								function("f", params(),
										let("y", block(
												let("z", num(1)),
												expr(binop(BinOp.ADD_INT, local("z"), num(2))))),
										expr(local("y")))),
						"def f():\n" +
								"    z = 1\n" +
								"    y = z + 2\n" +
								"    return y\n",
				},
				// a block in tail position returns its last expression
				{
						module("app",
								function("f", params(),
										expr(block(
												let("z", num(1)),
												expr(local("z")))))),
						"def f():\n" +
								"    z = 1\n" +
								"    return z\n",
				},
				// the value of a trailing let is returned
				{
						module("app",
								function("f", params(), let("unused", str("done")))),
						"def f():\n" +
								"    return \"done\"\n",
				},
				{
						module("app",
								constant("limit", num(10)),
								function("f", params(), expr(moduleConst("app", "limit")))),
						"def f():\n" +
								"    return limit\n" +
								"\n" +
								"limit = 10\n",
				},
				{
						module("app",
								function("class", params("in"), expr(local("in")))),
						"def class_(in_):\n" +
								"    return in_\n",
				},
				{
						module("app",
								function("f",
										params("first_argument_value", "second_argument_value",
												"third_argument_value"),
										expr(call(moduleFn("app", "some_function_name"),
												local("first_argument_value"),
												local("second_argument_value"),
												local("third_argument_value"))))),
						"def f(first_argument_value, second_argument_value, third_argument_value):\n" +
								"    return some_function_name(\n" +
								"        first_argument_value,\n" +
								"        second_argument_value,\n" +
								"        third_argument_value,\n" +
								"    )\n",
				},
				{
						module("app",
								function("f", args(discardArg(), arg("x"), discardArg(), discardArg()),
										expr(local("x")))),
						"def f(_, x, _1, _2):\n" +
								"    return x\n",
				},
				// imported names are module globals, so a local of the same name must not reuse it
				{
						module("app",
								importUnqualified("a", unqualified("c")),
								function("f", params(),
										expr(block(expr(call(moduleFn("a", "c"))))),
										let("c", num(1)),
										expr(local("c")))),
						"from a import (c)\n" +
								"\n" +
								"def f():\n" +
								"    c()\n" +
								"    c$1 = 1\n" +
								"    return c$1\n",
				},
				{
						module("app",
								function("first", params(), expr(num(1))),
								function("second", params(), expr(call(moduleFn("app", "first"))))),
						"def first():\n" +
								"    return 1\n" +
								"\n" +
								"def second():\n" +
								"    return first()\n",
				},
				// import foo as class
				// import a/b as def
				// fn f() { class.run(def.go()) }
				{
						module("app",
								importAs("foo", "class"),
								importAs("a/b", "def"),
								function("f", params(),
										expr(call(select("foo", "class", "run"), call(select("a/b", "def", "go")))))),
						"import foo as class_\n" +
								"from a import (b as def_)\n" +
								"\n" +
								"def f():\n" +
								"    return class_.run(def_.go())\n",
				},
		});
	}

	private final TypedModule module;
	private final String expected;

	public PythonCodeGenPassTest(TypedModule module, String expected) {
		this.module = module;
		this.expected = expected;
	}

	@Test
	public void test() {
		String actual = PythonCodeGenPass.perform(
				module, new LineNumbers(""), Paths.get("src/app.gleam"), "", new PyGenOptions());
		assertThat(actual, is(expected));
	}

}
