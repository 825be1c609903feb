package pygen.formatters;

import pygen.errors.ContextVisitor;
import pygen.trans.passes.codegen.python.GeneratingModule;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GeneratingModule generatingModule) throws IOException {
		out.write("while generating Python for ");
		out.write(String.valueOf(generatingModule.getPath()));
		return null;
	}

}
