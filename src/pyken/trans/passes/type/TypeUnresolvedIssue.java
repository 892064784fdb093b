package pyken.trans.passes.type;

import pyken.errors.Issue;
import pyken.errors.IssueVisitor;
import pyken.util.SourceLocation;

public class TypeUnresolvedIssue extends Issue {
	private final String name;
	private final SourceLocation location;

	public TypeUnresolvedIssue(String name, SourceLocation location) {
		this.name = name;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
