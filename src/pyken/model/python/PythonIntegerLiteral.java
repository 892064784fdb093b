package pyken.model.python;

import pyken.util.SourceLocation;

import java.math.BigInteger;
import java.util.Objects;

public class PythonIntegerLiteral extends PythonExpression {

	private final BigInteger value;

	public PythonIntegerLiteral(SourceLocation location, BigInteger value) {
		super(location);
		this.value = value;
	}

	public BigInteger getValue() {
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
		PythonIntegerLiteral that = (PythonIntegerLiteral) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
