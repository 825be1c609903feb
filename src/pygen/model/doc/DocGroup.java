package pygen.model.doc;

import java.util.Objects;

/**
 * Lays out its content flat if it fits on the remainder of the current line, otherwise broken.
 * Groups nested inside a broken group decide for themselves.
 */
public class DocGroup extends Document {
	private final Document document;

	public DocGroup(Document document) {
		this.document = document;
	}

	public Document getDocument() {
		return document;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocGroup docGroup = (DocGroup) o;
		return Objects.equals(document, docGroup.document);
	}

	@Override
	public int hashCode() {
		return Objects.hash(document);
	}
}
