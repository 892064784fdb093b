package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonReturn extends PythonStatement {

	private final PythonExpression value;

	public PythonReturn(SourceLocation location, PythonExpression value) {
		super(location);
		this.value = value;
	}

	/**
	 * @return the returned value, or null for a bare return
	 */
	public PythonExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonReturn that = (PythonReturn) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
