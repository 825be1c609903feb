package pygen.trans.passes.codegen.python;

import pygen.errors.Issue;
import pygen.errors.IssueVisitor;
import pygen.util.SourceSpan;

/**
 * A construct that has no Python lowering. This is the only issue that {@link
 * pygen.trans.TargetSupport#OPTIONAL} turns into an omitted definition.
 */
public class UnsupportedFeatureIssue extends Issue {

	private final String feature;
	private final SourceSpan location;

	public UnsupportedFeatureIssue(String feature, SourceSpan location) {
		super();
		this.feature = feature;
		this.location = location;
	}

	public String getFeature() {
		return feature;
	}

	public SourceSpan getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
