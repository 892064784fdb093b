package pyken.errors;

import pyken.trans.IOErrorIssue;
import pyken.trans.passes.codegen.aiken.AmbiguousPatternIssue;
import pyken.trans.passes.codegen.aiken.UnsupportedConstructIssue;
import pyken.trans.passes.parse.json.ParsingIssue;
import pyken.trans.passes.parse.option.OptionParserIssue;
import pyken.trans.passes.type.TypeUnresolvedIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedConstructIssue unsupportedConstructIssue) throws E;
	public abstract T visit(AmbiguousPatternIssue ambiguousPatternIssue) throws E;
	public abstract T visit(TypeUnresolvedIssue typeUnresolvedIssue) throws E;
}
