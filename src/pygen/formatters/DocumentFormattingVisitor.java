package pygen.formatters;

import pygen.model.doc.*;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Lays out a {@link Document} within a target width.
 *
 * Documents are processed from a stack of frames, each carrying the indentation and break mode it
 * inherited from its parents. A group is laid out flat when {@link DocumentFitsVisitor} finds that
 * its flat rendering fits on the rest of the current line.
 */
public class DocumentFormattingVisitor extends DocumentVisitor<Void, IOException> {

	enum Mode {
		FLAT,
		BROKEN,
	}

	static class Frame {
		final int indent;
		final Mode mode;
		final Document document;

		Frame(int indent, Mode mode, Document document) {
			this.indent = indent;
			this.mode = mode;
			this.document = document;
		}
	}

	private final IndentingWriter out;
	private final int limit;
	private final Deque<Frame> frames = new ArrayDeque<>();
	private Frame current;
	private int width;

	public DocumentFormattingVisitor(IndentingWriter out, int limit) {
		this.out = out;
		this.limit = limit;
	}

	public void format(Document document) throws IOException {
		width = out.getHorizontalPosition();
		frames.push(new Frame(0, Mode.BROKEN, document));
		while (!frames.isEmpty()) {
			current = frames.pop();
			current.document.accept(this);
		}
	}

	@Override
	public Void visit(DocText text) throws IOException {
		out.write(text.getText());
		width += text.getWidth();
		return null;
	}

	@Override
	public Void visit(DocLine line) throws IOException {
		for (int i = 0; i < line.getCount(); i++) {
			out.newLine(current.indent);
		}
		width = current.indent;
		return null;
	}

	@Override
	public Void visit(DocBreak docBreak) throws IOException {
		if (current.mode == Mode.FLAT) {
			out.write(docBreak.getUnbroken());
			width += docBreak.getUnbroken().codePointCount(0, docBreak.getUnbroken().length());
		} else {
			out.write(docBreak.getBroken());
			out.newLine(current.indent);
			width = current.indent;
		}
		return null;
	}

	@Override
	public Void visit(DocNest nest) throws IOException {
		frames.push(new Frame(current.indent + nest.getIndent(), current.mode, nest.getDocument()));
		return null;
	}

	@Override
	public Void visit(DocGroup group) throws IOException {
		Mode mode = current.mode;
		if (mode == Mode.BROKEN) {
			boolean fits = new DocumentFitsVisitor(limit - width).fits(group.getDocument());
			mode = fits ? Mode.FLAT : Mode.BROKEN;
		}
		frames.push(new Frame(current.indent, mode, group.getDocument()));
		return null;
	}

	@Override
	public Void visit(DocConcat concat) throws IOException {
		for (int i = concat.getDocuments().size() - 1; i >= 0; i--) {
			frames.push(new Frame(current.indent, current.mode, concat.getDocuments().get(i)));
		}
		return null;
	}
}
