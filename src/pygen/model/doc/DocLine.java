package pygen.model.doc;

import java.util.Objects;

/**
 * One or more unconditional line breaks. The line following the last break starts at the current
 * nesting level.
 */
public class DocLine extends Document {
	private final int count;

	public DocLine(int count) {
		if (count < 1) {
			throw new IllegalArgumentException("a line document needs at least one line break");
		}
		this.count = count;
	}

	public int getCount() {
		return count;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocLine docLine = (DocLine) o;
		return count == docLine.count;
	}

	@Override
	public int hashCode() {
		return Objects.hash(count);
	}
}
