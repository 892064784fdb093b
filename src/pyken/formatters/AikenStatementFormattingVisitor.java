package pyken.formatters;

import pyken.model.aiken.*;

import java.io.IOException;
import java.util.List;

public class AikenStatementFormattingVisitor extends AikenStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public AikenStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * Writes a braced block, one statement per line, leaving the writer just after the closing brace.
	 */
	public void writeBlock(List<AikenStatement> body) throws IOException {
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (AikenStatement statement : body) {
				out.newLine();
				statement.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(AikenLet let) throws IOException {
		out.write("let ");
		out.write(let.getPattern());
		out.write(" = ");
		out.write(let.getValue());
		return null;
	}

	@Override
	public Void visit(AikenRecordDestructure recordDestructure) throws IOException {
		out.write("let ");
		out.write(recordDestructure.getConstructor());
		if (recordDestructure.getFields() == null) {
			out.write(" { .. }");
		} else {
			out.write(" {");
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (String field : recordDestructure.getFields()) {
					out.newLine();
					out.write(field);
					out.write(",");
				}
			}
			out.newLine();
			out.write("}");
		}
		out.write(" = ");
		out.write(recordDestructure.getValue());
		return null;
	}

	@Override
	public Void visit(AikenExpect expect) throws IOException {
		out.write("expect ");
		if (expect.getPattern() != null) {
			out.write(expect.getPattern());
			out.write(" = ");
		}
		out.write(expect.getValue());
		return null;
	}

	@Override
	public Void visit(AikenWhen when) throws IOException {
		out.write("when ");
		out.write(when.getSubject());
		out.write(" is {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (AikenWhenArm arm : when.getArms()) {
				out.newLine();
				arm.accept(new AikenNodeFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(AikenIf anIf) throws IOException {
		out.write("if ");
		out.write(anIf.getCondition());
		out.write(" ");
		writeBlock(anIf.getThen());
		if (!anIf.getElse().isEmpty()) {
			out.write(" else ");
			writeBlock(anIf.getElse());
		}
		return null;
	}

	@Override
	public Void visit(AikenPipeline pipeline) throws IOException {
		out.write(pipeline.getBase());
		for (String stage : pipeline.getStages()) {
			out.newLine();
			out.write("|> ");
			out.write(stage);
		}
		return null;
	}

	@Override
	public Void visit(AikenFail fail) throws IOException {
		out.write("fail");
		return null;
	}

	@Override
	public Void visit(AikenExpression expression) throws IOException {
		out.write(expression.getCode());
		return null;
	}
}
