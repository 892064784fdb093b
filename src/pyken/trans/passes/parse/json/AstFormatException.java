package pyken.trans.passes.parse.json;

/**
 * The JSON document is well-formed but does not have the shape of a serialized Python AST.
 */
public class AstFormatException extends Exception {

	public AstFormatException(String message) {
		super(message);
	}
}
