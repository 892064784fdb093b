package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonSubscript extends PythonExpression {

	private final PythonExpression value;
	private final PythonExpression index;

	public PythonSubscript(SourceLocation location, PythonExpression value, PythonExpression index) {
		super(location);
		this.value = value;
		this.index = index;
	}

	public PythonExpression getValue() {
		return value;
	}

	public PythonExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonSubscript that = (PythonSubscript) o;
		return Objects.equals(value, that.value) &&
				Objects.equals(index, that.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, index);
	}
}
