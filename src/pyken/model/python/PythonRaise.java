package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonRaise extends PythonStatement {

	private final PythonExpression exception;

	public PythonRaise(SourceLocation location, PythonExpression exception) {
		super(location);
		this.exception = exception;
	}

	public PythonExpression getException() {
		return exception;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonRaise that = (PythonRaise) o;
		return Objects.equals(exception, that.exception);
	}

	@Override
	public int hashCode() {
		return Objects.hash(exception);
	}
}
