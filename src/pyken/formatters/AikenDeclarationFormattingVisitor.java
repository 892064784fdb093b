package pyken.formatters;

import pyken.model.aiken.*;

import java.io.IOException;
import java.util.List;

public class AikenDeclarationFormattingVisitor extends AikenDeclarationVisitor<Void, IOException> {

	private final IndentingWriter out;

	public AikenDeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(AikenUse use) throws IOException {
		out.write("use ");
		out.write(use.getModule());
		if (!use.getNames().isEmpty()) {
			out.write(".{");
			FormattingTools.writeCommaSeparated(out, use.getNames(), out::write);
			out.write("}");
		} else if (use.getAlias() != null) {
			out.write(" as ");
			out.write(use.getAlias());
		}
		return null;
	}

	@Override
	public Void visit(AikenTypeDefinition typeDefinition) throws IOException {
		out.write("pub type ");
		out.write(typeDefinition.getName());
		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			if (typeDefinition.isRecordShorthand()) {
				List<AikenField> fields = typeDefinition.getConstructors().get(0).getFields();
				for (int i = 0; i < fields.size(); i++) {
					out.newLine();
					fields.get(i).accept(new AikenNodeFormattingVisitor(out));
					if (i < fields.size() - 1) {
						out.write(",");
					}
				}
			} else {
				for (AikenConstructor constructor : typeDefinition.getConstructors()) {
					out.newLine();
					constructor.accept(new AikenNodeFormattingVisitor(out));
				}
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(AikenValidator validator) throws IOException {
		out.write("validator ");
		out.write(validator.getName());
		if (!validator.getParameters().isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, validator.getParameters(),
					p -> p.accept(new AikenNodeFormattingVisitor(out)));
			out.write(")");
		}
		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (AikenHandler handler : validator.getHandlers()) {
				out.newLine();
				handler.accept(new AikenNodeFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(AikenFunction function) throws IOException {
		out.write("fn ");
		out.write(function.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, function.getParameters(),
				p -> p.accept(new AikenNodeFormattingVisitor(out)));
		out.write(") ");
		if (function.getReturnType() != null) {
			out.write("-> ");
			out.write(function.getReturnType());
			out.write(" ");
		}
		new AikenStatementFormattingVisitor(out).writeBlock(function.getBody());
		return null;
	}

	@Override
	public Void visit(AikenTest test) throws IOException {
		out.write("test ");
		out.write(test.getName());
		out.write("() ");
		new AikenStatementFormattingVisitor(out).writeBlock(test.getBody());
		return null;
	}

	@Override
	public Void visit(AikenConstant constant) throws IOException {
		out.write("const ");
		out.write(constant.getName());
		if (constant.getType() != null) {
			out.write(": ");
			out.write(constant.getType());
		}
		out.write(" = ");
		out.write(constant.getValue());
		return null;
	}

	@Override
	public Void visit(AikenComment comment) throws IOException {
		out.write("// ");
		out.write(comment.getText());
		return null;
	}
}
