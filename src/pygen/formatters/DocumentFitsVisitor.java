package pygen.formatters;

import pygen.model.doc.*;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Decides whether a document laid out flat fits in the remaining width of a line.
 *
 * Each visit returns null to keep measuring, or a verdict once one is known. A hard line break ends
 * the measured line, so anything after it does not count.
 */
public class DocumentFitsVisitor extends DocumentVisitor<Boolean, RuntimeException> {

	private final Deque<Document> pending = new ArrayDeque<>();
	private int remaining;

	public DocumentFitsVisitor(int remaining) {
		this.remaining = remaining;
	}

	public boolean fits(Document document) {
		pending.push(document);
		while (remaining >= 0) {
			if (pending.isEmpty()) {
				return true;
			}
			Boolean verdict = pending.pop().accept(this);
			if (verdict != null) {
				return verdict;
			}
		}
		return false;
	}

	@Override
	public Boolean visit(DocText text) {
		remaining -= text.getWidth();
		return null;
	}

	@Override
	public Boolean visit(DocLine line) {
		return remaining >= 0;
	}

	@Override
	public Boolean visit(DocBreak docBreak) {
		remaining -= docBreak.getUnbroken().codePointCount(0, docBreak.getUnbroken().length());
		return null;
	}

	@Override
	public Boolean visit(DocNest nest) {
		pending.push(nest.getDocument());
		return null;
	}

	@Override
	public Boolean visit(DocGroup group) {
		pending.push(group.getDocument());
		return null;
	}

	@Override
	public Boolean visit(DocConcat concat) {
		for (int i = concat.getDocuments().size() - 1; i >= 0; i--) {
			pending.push(concat.getDocuments().get(i));
		}
		return null;
	}
}
