package pygen.errors;

import pygen.trans.passes.codegen.python.IdentifierCollisionIssue;
import pygen.trans.passes.codegen.python.UnsupportedFeatureIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws E;
	public abstract T visit(IdentifierCollisionIssue identifierCollisionIssue) throws E;
}
