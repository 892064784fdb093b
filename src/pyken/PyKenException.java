package pyken;

/**
 * A PyKen exception whose message is prefixed with the kind of failure, e.g.
 * "Translation Error: ...".
 */
public abstract class PyKenException extends RuntimeException {

	private static final long serialVersionUID = -2481953318072245960L;

	public PyKenException(String prefix, String msg) {
		super(prefix + ": " + msg);
	}

}
