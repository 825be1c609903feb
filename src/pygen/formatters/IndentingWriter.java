package pygen.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line after a line break. Indentation is written lazily, when the
 * first character of the next line arrives, so empty lines carry no trailing whitespace.
 *
 * Line breaks are always written as "\n" so generated code does not depend on the host platform.
 */
public class IndentingWriter extends Writer {

	public static final String LINE_SEPARATOR = "\n";

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	int defaultIndent = 4;
	int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * @return the 0-based position along the current line of text being written, counting any
	 * indentation that is still pending
	 */
	public int getHorizontalPosition() {
		if (shouldIndent) {
			return indent;
		}
		return horizontalPosition;
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(LINE_SEPARATOR);
	}

	/**
	 * Ends the current line. The next line starts at column, regardless of any open {@link Indent}.
	 */
	public void newLine(int column) throws IOException {
		newLine();
		indent = column;
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			int next = data.indexOf(LINE_SEPARATOR, start);
			if(shouldIndent && next != start) {
				for(int i = 0; i < indent; ++i) {
					out.write(" ");
				}
				shouldIndent = false;
				horizontalPosition = indent;
			}
			if(next != -1) {
				out.write(data, start, next - start + LINE_SEPARATOR.length());
				start = next + LINE_SEPARATOR.length();
				shouldIndent = true;
				horizontalPosition = 0;
			}else {
				horizontalPosition += data.codePointCount(start, data.length());
				out.write(data, start, data.length() - start);
				break;
			}
		}
	}

}
