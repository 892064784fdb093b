package pyken.trans.passes.codegen.aiken;

import pyken.errors.Issue;
import pyken.errors.IssueVisitor;
import pyken.util.SourceLocation;

/**
 * Code that looked like a dispatch chain or a pipeline did not meet the preconditions of the
 * rewrite and was emitted through the generic path instead.
 */
public class AmbiguousPatternIssue extends Issue {

	public enum Reconstruction {
		DISPATCH("discriminated dispatch"),
		PIPELINE("pipeline");

		private final String description;

		Reconstruction(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Reconstruction reconstruction;
	private final String reason;
	private final SourceLocation location;

	public AmbiguousPatternIssue(Reconstruction reconstruction, String reason, SourceLocation location) {
		this.reconstruction = reconstruction;
		this.reason = reason;
		this.location = location;
	}

	public Reconstruction getReconstruction() {
		return reconstruction;
	}

	public String getReason() {
		return reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
