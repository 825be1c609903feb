package pygen.trans.passes.codegen.python;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pygen.model.typed.TypedDefinition;

import static pygen.model.typed.TypedBuilder.*;

@RunWith(Parameterized.class)
public class ImportCollectionTest {

	@Parameters
	public static List<Object[]> testCases() {
		return Arrays.asList(new Object[][] {
				{
						Arrays.asList(),
						"",
				},
				{
						Arrays.asList(importModule("json")),
						"import json",
				},
				{
						Arrays.asList(importUnqualified("json", unqualified("dumps"), unqualifiedAs("loads", "parse"))),
						"from json import (dumps, loads as parse)",
				},
				{
						Arrays.asList(importDiscard("a/b", "_b"), importDiscard("c", "_c")),
						"",
				},
				{
						Arrays.asList(importAs("json", "j")),
						"import json as j",
				},
				{
						Arrays.asList(importModule("gleam/string/builder")),
						"from gleam.string import (builder)",
				},
				{
						Arrays.asList(importAs("gleam/string/builder", "sb")),
						"from gleam.string import (builder as sb)",
				},
				{
						Arrays.asList(importUnqualified("a/b", unqualified("c"), unqualified("d"))),
						"from a.b import (c, d)",
				},
				{
						Arrays.asList(importUnqualified("a/b", unqualifiedType("T"), unqualified("c"))),
						"from a.b import (c)",
				},
				{
						Arrays.asList(importUnqualified("a/b", unqualifiedType("T"))),
						"",
				},
				{
						Arrays.asList(importUnqualified("a/b", unqualified("not"), unqualifiedAs("x", "if"))),
						"from a.b import (not_, x as if_)",
				},
				{
						Arrays.asList(importAs("foo", "class"), importAs("a/b", "def")),
						"import foo as class_\n" +
								"from a import (b as def_)",
				},
				// one statement per path, in sorted order, members deduplicated
				{
						Arrays.asList(
								importUnqualified("b", unqualified("x")),
								importModule("a"),
								importAs("c", "cc"),
								importAs("d", "dd"),
								importUnqualified("b", unqualified("y"), unqualified("x"))),
						"import c as cc\n" +
								"import d as dd\n" +
								"import a\n" +
								"from b import (x, y)",
				},
				// a module imported both whole and for members
				{
						Arrays.asList(importModule("a"), importModule("a/b")),
						"import a\n" +
								"from a import (b)",
				},
				{
						Arrays.asList(
								externalFunction("now", params(), "time", "time"),
								externalFunction("time", params(), "time", "time"),
								externalFunction("sleep", params("s"), "time", "sleep")),
						"from time import (time as now, time, sleep)",
				},
				{
						Arrays.asList(
								externalFunction("print", params("s"), "builtins", "print"),
								externalFunction("print", params("s"), "builtins", "print")),
						"from builtins import (print)",
				},
				{
						Arrays.asList(externalFunction("is", params("a", "b"), "operator", "is_")),
						"from operator import (is_)",
				},
				{
						Arrays.asList(externalFunction("raise", params("e"), "my_ffi", "raise_error")),
						"from my_ffi import (raise_error as raise_)",
				},
				{
						Arrays.asList(function("local", params(), expr(num(1))), customType("T"), typeAlias("U"),
								constant("c", num(1))),
						"",
				},
		});
	}

	private final List<TypedDefinition> definitions;
	private final String expected;

	public ImportCollectionTest(List<TypedDefinition> definitions, String expected) {
		this.definitions = definitions;
		this.expected = expected;
	}

	@Test
	public void test() {
		Imports imports = new Imports();
		ImportCollectionVisitor visitor = new ImportCollectionVisitor(imports);
		for (TypedDefinition definition : definitions) {
			definition.accept(visitor);
		}
		assertThat(imports.toDocument(4).toString(), is(expected));
		assertThat(imports.isEmpty(), is(expected.isEmpty()));
	}

}
