package pyken.model.python;

import pyken.util.SourceLocation;

public abstract class PythonStatement extends PythonNode {

	public PythonStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E;

}
