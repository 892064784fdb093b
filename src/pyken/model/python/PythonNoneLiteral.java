package pyken.model.python;

import pyken.util.SourceLocation;

public class PythonNoneLiteral extends PythonExpression {

	public PythonNoneLiteral(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return PythonNoneLiteral.class.hashCode();
	}
}
