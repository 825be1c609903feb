package pygen.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class IndentingWriterTest {

	@Test
	public void indentsFollowingLines() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("a:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("b");
			assertThat(out.getHorizontalPosition(), is(5));
			out.newLine();
			out.newLine();
			out.write("c");
		}
		out.newLine();
		out.write("d");
		assertThat(w.toString(), is("a:\n    b\n\n    c\nd"));
	}

	@Test
	public void newLineAtColumn() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("x");
		out.newLine(6);
		assertThat(out.getHorizontalPosition(), is(6));
		out.write("y");
		out.newLine(0);
		out.write("z");
		assertThat(w.toString(), is("x\n      y\nz"));
	}

}
