package pyken.errors;

public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
	}

	@Override
	public void error(Issue err) {
		parent.error(err.withContext(context));
	}

	@Override
	public void warn(Issue warning) {
		parent.warn(warning.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return parent.hasErrors();
	}

	@Override
	public boolean hasWarnings() {
		return parent.hasWarnings();
	}

}
