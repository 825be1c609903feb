package pygen.model.doc;

import java.util.Objects;

/**
 * Literal text. Must not contain line breaks; use {@link DocLine} instead.
 */
public class DocText extends Document {
	private final String text;

	public DocText(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public int getWidth() {
		return text.codePointCount(0, text.length());
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocText docText = (DocText) o;
		return Objects.equals(text, docText.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
