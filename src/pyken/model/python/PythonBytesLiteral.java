package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Arrays;

public class PythonBytesLiteral extends PythonExpression {

	private final byte[] value;

	public PythonBytesLiteral(SourceLocation location, byte[] value) {
		super(location);
		this.value = value;
	}

	public byte[] getValue() {
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
		PythonBytesLiteral that = (PythonBytesLiteral) o;
		return Arrays.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(value);
	}
}
