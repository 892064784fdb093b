package pyken.trans;

import pyken.errors.Issue;

import java.util.List;

/**
 * Aiken source text together with the warnings raised wherever a translation rule fell back to a
 * degraded rendering, in the order they were raised.
 */
public class TranslationResult {

	private final String text;
	private final List<Issue> warnings;

	public TranslationResult(String text, List<Issue> warnings) {
		this.text = text;
		this.warnings = warnings;
	}

	public String getText() {
		return text;
	}

	public List<Issue> getWarnings() {
		return warnings;
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}
}
