package pygen.model.doc;

public abstract class DocumentVisitor<T, E extends Throwable> {
	public abstract T visit(DocText text) throws E;
	public abstract T visit(DocLine line) throws E;
	public abstract T visit(DocBreak docBreak) throws E;
	public abstract T visit(DocNest nest) throws E;
	public abstract T visit(DocGroup group) throws E;
	public abstract T visit(DocConcat concat) throws E;
}
