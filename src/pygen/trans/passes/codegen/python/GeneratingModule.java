package pygen.trans.passes.codegen.python;

import pygen.errors.Context;
import pygen.errors.ContextVisitor;
import pygen.util.LineNumbers;

import java.nio.file.Path;

/**
 * The module an issue was found in, with what is needed to point into its source.
 */
public class GeneratingModule extends Context {

	private final Path path;
	private final String src;
	private final LineNumbers lineNumbers;

	public GeneratingModule(Path path, String src, LineNumbers lineNumbers) {
		this.path = path;
		this.src = src;
		this.lineNumbers = lineNumbers;
	}

	public Path getPath() {
		return path;
	}

	public String getSrc() {
		return src;
	}

	public LineNumbers getLineNumbers() {
		return lineNumbers;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
