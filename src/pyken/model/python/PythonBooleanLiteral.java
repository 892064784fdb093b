package pyken.model.python;

import pyken.util.SourceLocation;

public class PythonBooleanLiteral extends PythonExpression {

	private final boolean value;

	public PythonBooleanLiteral(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonBooleanLiteral that = (PythonBooleanLiteral) o;
		return value == that.value;
	}

	@Override
	public int hashCode() {
		return Boolean.hashCode(value);
	}
}
