package pygen.model.doc;

import pygen.PyGenOptions;
import pygen.formatters.DocumentFormattingVisitor;
import pygen.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;

/**
 * A node of the pretty-printing algebra. Documents are immutable; the combinators below return new
 * documents.
 *
 * A document is laid out by {@link DocumentFormattingVisitor}, which picks for every {@link DocGroup}
 * whether its {@link DocBreak}s render flat or broken so that the output fits a target width.
 */
public abstract class Document {

	public abstract <T, E extends Throwable> T accept(DocumentVisitor<T, E> v) throws E;

	public Document append(Document other) {
		return new DocConcat(Arrays.asList(this, other));
	}

	public Document append(String text) {
		return append(new DocText(text));
	}

	public Document nest(int indent) {
		return new DocNest(indent, this);
	}

	public Document group() {
		return new DocGroup(this);
	}

	public Document surround(String open, String close) {
		return new DocConcat(Arrays.asList(new DocText(open), this, new DocText(close)));
	}

	public String toPrettyString(int width) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			new DocumentFormattingVisitor(out, width).format(this);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		return toPrettyString(PyGenOptions.DEFAULT_LINE_WIDTH);
	}
}
