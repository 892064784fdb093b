package pyken;

public class PyKenOptionException extends Exception {
	private static final long serialVersionUID = 4093117360458915541L;

	public PyKenOptionException(String message) {
		super(message);
	}
}
