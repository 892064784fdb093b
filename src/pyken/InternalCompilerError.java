package pyken;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String message) {
		super("internal compiler error: " + message);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
