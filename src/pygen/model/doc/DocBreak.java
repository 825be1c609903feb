package pygen.model.doc;

import java.util.Objects;

/**
 * An optional line break. When the enclosing group is laid out flat this renders as its unbroken
 * text; otherwise it renders its broken text followed by a line break.
 */
public class DocBreak extends Document {
	private final String broken;
	private final String unbroken;

	public DocBreak(String broken, String unbroken) {
		this.broken = broken;
		this.unbroken = unbroken;
	}

	public String getBroken() {
		return broken;
	}

	public String getUnbroken() {
		return unbroken;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocBreak docBreak = (DocBreak) o;
		return Objects.equals(broken, docBreak.broken) &&
				Objects.equals(unbroken, docBreak.unbroken);
	}

	@Override
	public int hashCode() {
		return Objects.hash(broken, unbroken);
	}
}
