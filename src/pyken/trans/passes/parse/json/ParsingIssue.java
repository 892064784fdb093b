package pyken.trans.passes.parse.json;

import pyken.errors.Issue;
import pyken.errors.IssueVisitor;

public class ParsingIssue extends Issue {
	private final String language;
	private final String detail;

	public ParsingIssue(String language, String detail) {
		this.language = language;
		this.detail = detail;
	}

	public ParsingIssue(String language, String detail, Exception cause) {
		this(language, detail);
		initCause(cause);
	}

	public String getDetail() {
		return detail;
	}

	public String getLanguage() { return language; }

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
