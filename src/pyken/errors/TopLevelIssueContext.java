package pyken.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import pyken.formatters.IndentingWriter;
import pyken.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;
	private final List<Issue> warnings;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
		this.warnings = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public void warn(Issue warning) {
		warnings.add(warning);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	@Override
	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	public List<Issue> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	private static void format(IndentingWriter out, List<Issue> issues) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(issues.size()));
		out.write(" issue(s):");
		for (Issue e : issues) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
	}

	private static String format(List<Issue> issues) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out, issues);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	public void format(IndentingWriter out) throws IOException {
		format(out, errors);
	}

	public String format() {
		return format(errors);
	}

	public String formatWarnings() {
		return format(warnings);
	}
}
