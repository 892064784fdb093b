package pyken.trans;

import pyken.InternalCompilerError;
import pyken.errors.TopLevelIssueContext;
import pyken.formatters.AikenNodeFormattingVisitor;
import pyken.formatters.IndentingWriter;
import pyken.model.aiken.AikenModule;
import pyken.model.python.PythonModule;
import pyken.trans.passes.codegen.aiken.AikenCodeGenPass;

import java.io.IOException;
import java.io.StringWriter;

public class PyKenTranslator {

	private PyKenTranslator() {}

	/**
	 * Translates one module. This never fails on a well-formed tree; constructs without a translation
	 * rule are rendered as placeholders and reported among the warnings.
	 */
	public static TranslationResult translate(PythonModule module) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		AikenModule aikenModule = AikenCodeGenPass.perform(ctx, module);
		StringWriter writer = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(writer)) {
			aikenModule.accept(new AikenNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new InternalCompilerError(e);
		}
		return new TranslationResult(writer.toString(), ctx.getWarnings());
	}
}
