package pyken.model.python;

import pyken.util.SourceLocation;

public abstract class PythonExpression extends PythonNode {

	public PythonExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E;

}
