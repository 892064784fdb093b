package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonAttribute extends PythonExpression {

	private final PythonExpression value;
	private final String attribute;

	public PythonAttribute(SourceLocation location, PythonExpression value, String attribute) {
		super(location);
		this.value = value;
		this.attribute = attribute;
	}

	public PythonExpression getValue() {
		return value;
	}

	public String getAttribute() {
		return attribute;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAttribute that = (PythonAttribute) o;
		return Objects.equals(value, that.value) &&
				Objects.equals(attribute, that.attribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, attribute);
	}
}
