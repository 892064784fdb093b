package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonAssert extends PythonStatement {

	private final PythonExpression test;
	private final PythonExpression message;

	public PythonAssert(SourceLocation location, PythonExpression test, PythonExpression message) {
		super(location);
		this.test = test;
		this.message = message;
	}

	public PythonExpression getTest() {
		return test;
	}

	public PythonExpression getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAssert that = (PythonAssert) o;
		return Objects.equals(test, that.test) &&
				Objects.equals(message, that.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, message);
	}
}
