package pygen.model.doc;

import java.util.List;
import java.util.Objects;

public class DocConcat extends Document {
	private final List<Document> documents;

	public DocConcat(List<Document> documents) {
		this.documents = documents;
	}

	public List<Document> getDocuments() {
		return documents;
	}

	@Override
	public <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DocConcat docConcat = (DocConcat) o;
		return Objects.equals(documents, docConcat.documents);
	}

	@Override
	public int hashCode() {
		return Objects.hash(documents);
	}
}
