package pygen.model.doc;

import java.util.Objects;

public class DocNest extends Document {
	private final int indent;
	private final Document document;

	public DocNest(int indent, Document document) {
		this.indent = indent;
		this.document = document;
	}

	public int getIndent() {
		return indent;
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
		DocNest docNest = (DocNest) o;
		return indent == docNest.indent &&
				Objects.equals(document, docNest.document);
	}

	@Override
	public int hashCode() {
		return Objects.hash(indent, document);
	}
}
