package pyken.formatters;

import pyken.errors.IssueVisitor;
import pyken.errors.IssueWithContext;
import pyken.trans.IOErrorIssue;
import pyken.trans.passes.codegen.aiken.AmbiguousPatternIssue;
import pyken.trans.passes.codegen.aiken.UnsupportedConstructIssue;
import pyken.trans.passes.parse.json.ParsingIssue;
import pyken.trans.passes.parse.option.OptionParserIssue;
import pyken.trans.passes.type.TypeUnresolvedIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing " + parsingIssue.getLanguage() + ": ");
		out.write(parsingIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(UnsupportedConstructIssue unsupportedConstructIssue) throws IOException {
		out.write("no translation rule for ");
		out.write(unsupportedConstructIssue.getKind());
		out.write(", emitted a placeholder ");
		unsupportedConstructIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(AmbiguousPatternIssue ambiguousPatternIssue) throws IOException {
		out.write(ambiguousPatternIssue.getReconstruction().getDescription());
		out.write(" not reconstructed (");
		out.write(ambiguousPatternIssue.getReason());
		out.write(") ");
		ambiguousPatternIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(TypeUnresolvedIssue typeUnresolvedIssue) throws IOException {
		out.write("could not resolve a type for ");
		out.write(typeUnresolvedIssue.getName());
		out.write(", falling back to Data ");
		typeUnresolvedIssue.getLocation().writePretty(out);
		return null;
	}
}
