package pyken.formatters;

import pyken.errors.ContextVisitor;
import pyken.trans.passes.codegen.aiken.WhileEmittingDeclaration;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileEmittingDeclaration whileEmittingDeclaration) throws IOException {
		out.write("while emitting declaration ");
		out.write(whileEmittingDeclaration.getName());
		out.write(" ");
		whileEmittingDeclaration.getLocation().writePretty(out);
		return null;
	}

}
