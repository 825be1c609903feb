package pygen.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;

import org.junit.Test;

import pygen.errors.IssueWithContext;
import pygen.trans.passes.codegen.python.GeneratingModule;
import pygen.trans.passes.codegen.python.IdentifierCollisionIssue;
import pygen.trans.passes.codegen.python.UnsupportedFeatureIssue;
import pygen.util.LineNumbers;
import pygen.util.SourceSpan;

public class IssueFormattingTest {

	private static GeneratingModule moduleOf(String src) {
		return new GeneratingModule(Paths.get("src/app.gleam"), src, new LineNumbers(src));
	}

	@Test
	public void unknownLocation() {
		assertThat(new UnsupportedFeatureIssue("list", SourceSpan.unknown()).getMessage(),
				is("unsupported feature: list at unknown source location"));
	}

	@Test
	public void locationWithoutSource() {
		assertThat(new UnsupportedFeatureIssue("list", new SourceSpan(3, 7)).getMessage(),
				is("unsupported feature: list at bytes 3-7"));
	}

	@Test
	public void identifierCollision() {
		assertThat(new IdentifierCollisionIssue("class", "class_", SourceSpan.unknown()).getMessage(),
				is("reserved word \"class\" would be renamed to \"class_\", which is already in use " +
						"at unknown source location"));
	}

	@Test
	public void locationWithSourceExcerpt() {
		String src = "pub fn main() {\n  case x { _ -> 1 }\n}\n";
		IssueWithContext issue = new UnsupportedFeatureIssue("case expression", new SourceSpan(18, 35))
				.withContext(moduleOf(src));
		assertThat(issue.getMessage(), is(
				"while generating Python for src/app.gleam\n" +
						"    unsupported feature: case expression at 2:3-2:20\n" +
						"        case x { _ -> 1 }\n" +
						"        ^^^^^^^^^^^^^^^^^"));
	}

	@Test
	public void emptySpanIsMarkedWithOneCaret() {
		String src = "a\nbcd\n";
		IssueWithContext issue = new UnsupportedFeatureIssue("list", new SourceSpan(3, 3))
				.withContext(moduleOf(src));
		assertThat(issue.getMessage(), is(
				"while generating Python for src/app.gleam\n" +
						"    unsupported feature: list at 2:2\n" +
						"      bcd\n" +
						"       ^"));
	}

}
