package pygen.trans.passes.codegen.python;

import pygen.errors.Issue;
import pygen.errors.IssueVisitor;
import pygen.util.SourceSpan;

/**
 * Escaping the reserved word name yields escaped, which is already used by another binding.
 */
public class IdentifierCollisionIssue extends Issue {

	private final String name;
	private final String escaped;
	private final SourceSpan location;

	public IdentifierCollisionIssue(String name, String escaped, SourceSpan location) {
		super();
		this.name = name;
		this.escaped = escaped;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public String getEscaped() {
		return escaped;
	}

	public SourceSpan getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
