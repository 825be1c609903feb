package pygen.trans.passes.codegen.python;

import pygen.model.doc.Document;
import pygen.model.typed.*;
import pygen.scope.ScopeTable;

import java.util.ArrayList;
import java.util.List;

import static pygen.model.doc.DocBuilder.*;

/**
 * Lowers the left hand side of an assignment, binding the names it introduces in the scope.
 */
public class PatternCodeGenVisitor extends TypedPatternVisitor<Document, UnsupportedFeatureIssue> {

	private final ScopeTable scope;
	private final int indent;

	public PatternCodeGenVisitor(ScopeTable scope, int indent) {
		this.scope = scope;
		this.indent = indent;
	}

	@Override
	public Document visit(TypedVariablePattern variablePattern) throws UnsupportedFeatureIssue {
		return text(Identifiers.bindVariable(scope, variablePattern.getName(), variablePattern.getLocation()));
	}

	@Override
	public Document visit(TypedDiscardPattern discardPattern) throws UnsupportedFeatureIssue {
		return text("_");
	}

	@Override
	public Document visit(TypedTuplePattern tuplePattern) throws UnsupportedFeatureIssue {
		List<TypedPattern> elements = tuplePattern.getElements();
		if (elements.size() == 1) {
			return elements.get(0).accept(this).surround("(", ",)");
		}
		List<Document> documents = new ArrayList<>();
		for (TypedPattern element : elements) {
			documents.add(element.accept(this));
		}
		return wrapArguments(documents, indent);
	}

	@Override
	public Document visit(TypedConstructorPattern constructorPattern) throws UnsupportedFeatureIssue {
		throw new UnsupportedFeatureIssue("constructor pattern", constructorPattern.getLocation());
	}
}
