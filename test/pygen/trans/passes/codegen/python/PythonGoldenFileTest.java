package pygen.trans.passes.codegen.python;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pygen.PyGenOptions;
import pygen.model.typed.BinOp;
import pygen.model.typed.TypedModule;
import pygen.trans.TargetSupport;
import pygen.util.LineNumbers;

import static pygen.model.typed.TypedBuilder.*;

/**
 * Compares generated modules with the expected Python under ./test/python.
 */
@RunWith(Parameterized.class)
public class PythonGoldenFileTest {

	private static PyGenOptions narrow() {
		PyGenOptions opts = new PyGenOptions(TargetSupport.OPTIONAL);
		opts.lineWidth = 40;
		opts.indent = 2;
		return opts;
	}

	@Parameters(name = "{0}")
	public static List<Object[]> testCases() {
		return Arrays.asList(new Object[][] {
				{
						"geometry",
						module("app/geometry",
								importModule("gleam/io"),
								importUnqualified("gleam/float", unqualifiedAs("square_root", "sqrt")),
								externalFunction("now", params(), "time", "monotonic"),
								// fn distance(a, b) {
								//   let dx = a.0 - b.0
								//   let dy = a.1 - b.1
								//   sqrt(dx *. dx +. dy *. dy)
								// }
								publicFunction("distance", params("a", "b"),
										let("dx", binop(BinOp.SUB_FLOAT, tupleIndex(local("a"), 0), tupleIndex(local("b"), 0))),
										let("dy", binop(BinOp.SUB_FLOAT, tupleIndex(local("a"), 1), tupleIndex(local("b"), 1))),
										expr(call(moduleFn("gleam/float", "sqrt"),
												binop(BinOp.ADD_FLOAT,
														binop(BinOp.MULT_FLOAT, local("dx"), local("dx")),
														binop(BinOp.MULT_FLOAT, local("dy"), local("dy")))))),
								// fn count_down(n, acc) {
								//   io.println("tick")
								//   count_down(n - 1, acc <> "!")
								// }
								function("count_down", params("n", "acc"),
										expr(call(select("gleam/io", "io", "println"), str("tick"))),
										expr(call(moduleFn("app/geometry", "count_down"),
												binop(BinOp.SUB_INT, local("n"), num(1)),
												binop(BinOp.CONCATENATE, local("acc"), str("!"))))),
								// fn describe(p) {
								//   let #(x, y) = p
								//   let label = "point\n"
								//   #(label, x, y, !True)
								// }
								function("describe", params("p"),
										let(pTuple(pVar("x"), pVar("y")), local("p")),
										let("label", str("point\n")),
										expr(tuple(local("label"), local("x"), local("y"),
												negateBool(record("gleam", "True"))))),
								constant("origin", tuple(flt("0.0"), flt("0.0")))),
						new PyGenOptions(),
				},
				{
						"report",
						module("app/report",
								importUnqualified("gleam/string",
										unqualified("concat"), unqualified("join"),
										unqualified("pad_left"), unqualified("pad_right")),
								function("row", params("name", "value"),
										expr(call(moduleFn("gleam/string", "concat"),
												call(moduleFn("gleam/string", "pad_right"), local("name"), num(10)),
												call(moduleFn("gleam/string", "pad_left"), local("value"), num(10))))),
								function("bad", params(), expr(list(num(1))))),
						narrow(),
				},
		});
	}

	private final String name;
	private final TypedModule module;
	private final PyGenOptions opts;

	public PythonGoldenFileTest(String name, TypedModule module, PyGenOptions opts) {
		this.name = name;
		this.module = module;
		this.opts = opts;
	}

	@Test
	public void test() throws IOException {
		String expected;
		try (FileInputStream inputStream = new FileInputStream("./test/python/" + name + ".py")) {
			expected = IOUtils.toString(inputStream, StandardCharsets.UTF_8);
		}
		String actual = PythonCodeGenPass.perform(
				module, new LineNumbers(""), Paths.get("src/" + name + ".gleam"), "", opts);
		assertThat(actual, is(expected));
	}

}
