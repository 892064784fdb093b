package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * A keyword argument of a call. The name is null for {@code **kwargs} unpacking.
 */
public class PythonKeyword extends PythonNode {

	private final String name;
	private final PythonExpression value;

	public PythonKeyword(SourceLocation location, String name, PythonExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public PythonExpression getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonKeyword that = (PythonKeyword) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}
}
