package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonName extends PythonExpression {

	private final String id;

	public PythonName(SourceLocation location, String id) {
		super(location);
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonName that = (PythonName) o;
		return Objects.equals(id, that.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}
}
