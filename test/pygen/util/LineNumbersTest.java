package pygen.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class LineNumbersTest {

	private static final String SRC = "fn f() {\n  1\n}\n";

	@Test
	public void lineNumbers() {
		LineNumbers lineNumbers = new LineNumbers(SRC);
		assertThat(lineNumbers.getLineCount(), is(4));
		assertThat(lineNumbers.lineNumber(0), is(1));
		assertThat(lineNumbers.lineNumber(8), is(1));
		assertThat(lineNumbers.lineNumber(9), is(2));
		assertThat(lineNumbers.lineNumber(11), is(2));
		assertThat(lineNumbers.lineNumber(13), is(3));
		assertThat(lineNumbers.lineNumber(15), is(4));
	}

	@Test
	public void columnNumbers() {
		LineNumbers lineNumbers = new LineNumbers(SRC);
		assertThat(lineNumbers.columnNumber(0), is(1));
		assertThat(lineNumbers.columnNumber(3), is(4));
		assertThat(lineNumbers.columnNumber(11), is(3));
	}

	@Test
	public void lineBounds() {
		LineNumbers lineNumbers = new LineNumbers(SRC);
		assertThat(lineNumbers.lineStart(2), is(9));
		assertThat(lineNumbers.lineEnd(2), is(12));
		assertThat(lineNumbers.lineStart(4), is(15));
		assertThat(lineNumbers.lineEnd(4), is(15));
	}

	@Test
	public void offsetsAreBytes() {
		// "é" is two bytes in UTF-8
		LineNumbers lineNumbers = new LineNumbers("é\nx");
		assertThat(lineNumbers.lineNumber(3), is(2));
		assertThat(lineNumbers.columnNumber(3), is(1));
		assertThat(lineNumbers.columnNumber(2), is(3));
	}

	@Test
	public void offsetsPastTheEndAreClamped() {
		LineNumbers lineNumbers = new LineNumbers("ab");
		assertThat(lineNumbers.lineNumber(100), is(1));
		assertThat(lineNumbers.columnNumber(100), is(3));
	}

	@Test
	public void spans() {
		SourceSpan a = new SourceSpan(2, 5);
		SourceSpan b = new SourceSpan(4, 9);
		assertThat(a.combine(b), is(new SourceSpan(2, 9)));
		assertTrue(SourceSpan.unknown().isUnknown());
		assertFalse(a.isUnknown());
		assertTrue(a.compareTo(b) < 0);
	}

}
