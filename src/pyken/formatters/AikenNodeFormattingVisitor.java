package pyken.formatters;

import pyken.model.aiken.*;

import java.io.IOException;

public class AikenNodeFormattingVisitor extends AikenNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public AikenNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(AikenModule module) throws IOException {
		AikenDeclaration previous = null;
		for (AikenDeclaration declaration : module.getDeclarations()) {
			if (previous != null) {
				out.newLine();
				// consecutive use lines form one group
				if (!(previous instanceof AikenUse && declaration instanceof AikenUse)) {
					out.newLine();
				}
			}
			declaration.accept(new AikenDeclarationFormattingVisitor(out));
			previous = declaration;
		}
		if (previous != null) {
			out.newLine();
		}
		return null;
	}

	@Override
	public Void visit(AikenDeclaration declaration) throws IOException {
		declaration.accept(new AikenDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(AikenStatement statement) throws IOException {
		statement.accept(new AikenStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(AikenConstructor constructor) throws IOException {
		out.write(constructor.getName());
		if (!constructor.getFields().isEmpty()) {
			out.write(" { ");
			FormattingTools.writeCommaSeparated(out, constructor.getFields(), field -> field.accept(this));
			out.write(" }");
		}
		return null;
	}

	@Override
	public Void visit(AikenField field) throws IOException {
		out.write(field.getName());
		out.write(": ");
		out.write(field.getType());
		return null;
	}

	@Override
	public Void visit(AikenParameter parameter) throws IOException {
		out.write(parameter.getName());
		if (parameter.getType() != null) {
			out.write(": ");
			out.write(parameter.getType());
		}
		return null;
	}

	@Override
	public Void visit(AikenHandler handler) throws IOException {
		out.write(handler.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, handler.getParameters(), p -> p.accept(this));
		out.write(") ");
		new AikenStatementFormattingVisitor(out).writeBlock(handler.getBody());
		return null;
	}

	@Override
	public Void visit(AikenWhenArm whenArm) throws IOException {
		FormattingTools.writeSeparated(out, " | ", whenArm.getPatterns(), out::write);
		out.write(" -> ");
		out.write(whenArm.getResult());
		return null;
	}
}
