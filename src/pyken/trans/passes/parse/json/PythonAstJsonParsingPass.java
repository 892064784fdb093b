package pyken.trans.passes.parse.json;

import org.json.JSONException;
import org.json.JSONObject;
import pyken.errors.IssueContext;
import pyken.model.python.PythonModule;

import java.nio.file.Path;

public class PythonAstJsonParsingPass {

	private PythonAstJsonParsingPass() {}

	/**
	 * @return the parsed module, or null after reporting a {@link ParsingIssue}
	 */
	public static PythonModule perform(IssueContext ctx, Path inputFilePath, String text) {
		try {
			return new PythonAstJsonReader(inputFilePath).readModule(new JSONObject(text));
		} catch (JSONException e) {
			ctx.error(new ParsingIssue("Python AST JSON", e.getMessage(), e));
		} catch (AstFormatException e) {
			ctx.error(new ParsingIssue("Python AST", e.getMessage(), e));
		}
		return null;
	}
}
