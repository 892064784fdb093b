package pyken.trans;

import pyken.PyKenException;

/**
 * Exception during translation of a Python AST into Aiken source
 *
 */
public class PyKenTransException extends PyKenException {

	private static final long serialVersionUID = 4093326527195604127L;
	private static final String prefix = "Translation Error";

	public PyKenTransException(String msg) {
		super(prefix, msg);
	}

}
