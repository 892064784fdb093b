package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonAlias extends PythonNode {

	private final String name;
	private final String asName;

	public PythonAlias(SourceLocation location, String name, String asName) {
		super(location);
		this.name = name;
		this.asName = asName;
	}

	public String getName() {
		return name;
	}

	public String getAsName() {
		return asName;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAlias that = (PythonAlias) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(asName, that.asName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, asName);
	}
}
