package pyken.errors;

/**
 * Collects the issues raised while processing one input.
 *
 * Errors stop the surrounding pipeline. Warnings record that a translation rule fell back to a
 * degraded rendering; they never stop anything.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract void warn(Issue warning);

	public abstract boolean hasErrors();

	public abstract boolean hasWarnings();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
