package pygen.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps byte offsets of a UTF-8 source text to 1-based line and column numbers.
 *
 * Columns count bytes, so they agree with the offsets stored in {@link SourceSpan}.
 */
public class LineNumbers {
	private final List<Integer> lineStarts;
	private final int length;

	public LineNumbers(String src) {
		byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
		this.length = bytes.length;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < bytes.length; i++) {
			if (bytes[i] == '\n') {
				starts.add(i + 1);
			}
		}
		this.lineStarts = Collections.unmodifiableList(starts);
	}

	/**
	 * @param byteIndex an offset into the source, clamped to its length
	 * @return the 1-based line containing byteIndex
	 */
	public int lineNumber(int byteIndex) {
		int index = Collections.binarySearch(lineStarts, clamp(byteIndex));
		if (index >= 0) {
			return index + 1;
		}
		// insertion point is the first line starting after byteIndex
		return -index - 1;
	}

	public int columnNumber(int byteIndex) {
		int line = lineNumber(byteIndex);
		return clamp(byteIndex) - lineStarts.get(line - 1) + 1;
	}

	public int lineStart(int line) {
		return lineStarts.get(line - 1);
	}

	/**
	 * @return the offset just past the last byte of line, excluding its line break
	 */
	public int lineEnd(int line) {
		if (line < lineStarts.size()) {
			return lineStarts.get(line) - 1;
		}
		return length;
	}

	public int getLineCount() {
		return lineStarts.size();
	}

	private int clamp(int byteIndex) {
		return Integer.max(0, Integer.min(byteIndex, length));
	}
}
