package pygen.formatters;

import pygen.errors.ContextVisitor;
import pygen.errors.IssueVisitor;
import pygen.errors.IssueWithContext;
import pygen.trans.passes.codegen.python.GeneratingModule;
import pygen.trans.passes.codegen.python.IdentifierCollisionIssue;
import pygen.trans.passes.codegen.python.UnsupportedFeatureIssue;
import pygen.util.LineNumbers;
import pygen.util.SourceSpan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;
	private GeneratingModule module;

	public IssueFormattingVisitor(IndentingWriter out) {
		this(out, null);
	}

	/**
	 * @param module the module issues were found in; when known, locations are written as line and
	 *               column with an excerpt of the offending source line
	 */
	public IssueFormattingVisitor(IndentingWriter out, GeneratingModule module) {
		this.out = out;
		this.module = module;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		IssueFormattingVisitor inner = issueWithContext.getContext().accept(
				new ContextVisitor<IssueFormattingVisitor, RuntimeException>() {
					@Override
					public IssueFormattingVisitor visit(GeneratingModule generatingModule) {
						return new IssueFormattingVisitor(out, generatingModule);
					}
				});
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(inner);
		}
		return null;
	}

	@Override
	public Void visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws IOException {
		out.write("unsupported feature: ");
		out.write(unsupportedFeatureIssue.getFeature());
		out.write(" ");
		writeLocation(unsupportedFeatureIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(IdentifierCollisionIssue identifierCollisionIssue) throws IOException {
		out.write("reserved word \"");
		out.write(identifierCollisionIssue.getName());
		out.write("\" would be renamed to \"");
		out.write(identifierCollisionIssue.getEscaped());
		out.write("\", which is already in use ");
		writeLocation(identifierCollisionIssue.getLocation());
		return null;
	}

	private void writeLocation(SourceSpan location) throws IOException {
		if (location.isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		if (module == null) {
			out.write("at bytes " + location.getStart() + "-" + location.getEnd());
			return;
		}
		LineNumbers lineNumbers = module.getLineNumbers();
		byte[] src = module.getSrc().getBytes(StandardCharsets.UTF_8);
		int start = Integer.min(location.getStart(), src.length);
		int end = Integer.min(location.getEnd(), src.length);
		int startLine = lineNumbers.lineNumber(start);
		int endLine = lineNumbers.lineNumber(end);
		out.write("at " + startLine + ":" + lineNumbers.columnNumber(start));
		if (end != start) {
			out.write("-" + endLine + ":" + lineNumbers.columnNumber(end));
		}

		int lineStart = lineNumbers.lineStart(startLine);
		int lineEnd = lineNumbers.lineEnd(startLine);
		String line = new String(src, lineStart, lineEnd - lineStart, StandardCharsets.UTF_8);
		if (line.endsWith("\r")) {
			line = line.substring(0, line.length() - 1);
		}
		int markStart = countCodePoints(src, lineStart, start);
		int markLength = countCodePoints(src, start, Integer.min(end, lineEnd));
		try (IndentingWriter.Indent ignored = out.indent(2)) {
			out.newLine();
			out.write(line);
			out.newLine();
			for (int i = 0; i < markStart; i++) {
				out.write(" ");
			}
			for (int i = 0; i < Integer.max(1, markLength); i++) {
				out.write("^");
			}
		}
	}

	private static int countCodePoints(byte[] src, int from, int to) {
		if (to <= from) {
			return 0;
		}
		String s = new String(src, from, to - from, StandardCharsets.UTF_8);
		return s.codePointCount(0, s.length());
	}
}
