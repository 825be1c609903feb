package pygen.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pygen.model.doc.Document;

import static pygen.model.doc.DocBuilder.*;

@RunWith(Parameterized.class)
public class DocumentFormattingTest {

	@Parameters
	public static List<Object[]> testCases() {
		return Arrays.asList(new Object[][] {
				{EMPTY, 80, ""},
				{text("abc").append("def"), 80, "abcdef"},
				{wrapArguments(Arrays.asList(), 4), 80, "()"},
				{wrapArguments(Arrays.asList(text("a"), text("b")), 4), 80, "(a, b)"},
				// exactly at the limit still fits
				{wrapArguments(Arrays.asList(text("aaa"), text("bbb")), 4), 10, "(aaa, bbb)"},
				{wrapArguments(Arrays.asList(text("aaa"), text("bbb")), 4), 9, "(\n    aaa,\n    bbb,\n)"},
				// the outer group breaks first, leaving room for the inner one
				{
						wrapArguments(Arrays.asList(text("aaaa"),
								wrapArguments(Arrays.asList(text("bbbb"), text("cccc")), 4)), 4),
						18,
						"(\n    aaaa,\n    (bbbb, cccc),\n)",
				},
				{
						wrapArguments(Arrays.asList(text("aaaa"),
								wrapArguments(Arrays.asList(text("bbbb"), text("cccc")), 4)), 4),
						20,
						"(aaaa, (bbbb, cccc))",
				},
				// hard lines break even inside a group, and blank lines carry no indentation
				{
						text("def f():").append(concat(line(), text("a"), lines(2), text("b")).nest(4)).group(),
						80,
						"def f():\n    a\n\n    b",
				},
				{
						text("if x:").append(concat(line(), text("while True:"),
								concat(line(), text("pass")).nest(4)).nest(4)),
						80,
						"if x:\n    while True:\n        pass",
				},
				// width counts code points
				{wrapArguments(Arrays.asList(text("\u00e9\u00e9\u00e9"), text("\u00e9\u00e9\u00e9")), 4), 10,
						"(\u00e9\u00e9\u00e9, \u00e9\u00e9\u00e9)"},
		});
	}

	private final Document document;
	private final int width;
	private final String expected;

	public DocumentFormattingTest(Document document, int width, String expected) {
		this.document = document;
		this.width = width;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(document.toPrettyString(width), is(expected));
	}

}
