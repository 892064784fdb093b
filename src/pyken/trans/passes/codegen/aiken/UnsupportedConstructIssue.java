package pyken.trans.passes.codegen.aiken;

import pyken.errors.Issue;
import pyken.errors.IssueVisitor;
import pyken.util.SourceLocation;

/**
 * A statement or expression had no translation rule and was replaced by a placeholder.
 */
public class UnsupportedConstructIssue extends Issue {
	private final String kind;
	private final SourceLocation location;

	public UnsupportedConstructIssue(String kind, SourceLocation location) {
		this.kind = kind;
		this.location = location;
	}

	public String getKind() {
		return kind;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
