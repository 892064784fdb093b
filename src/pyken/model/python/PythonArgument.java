package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * A positional function parameter. The annotation and default value are null when absent.
 */
public class PythonArgument extends PythonNode {

	private final String name;
	private final PythonExpression annotation;
	private final PythonExpression defaultValue;

	public PythonArgument(SourceLocation location, String name, PythonExpression annotation,
	                      PythonExpression defaultValue) {
		super(location);
		this.name = name;
		this.annotation = annotation;
		this.defaultValue = defaultValue;
	}

	public String getName() {
		return name;
	}

	public PythonExpression getAnnotation() {
		return annotation;
	}

	public PythonExpression getDefaultValue() {
		return defaultValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonArgument that = (PythonArgument) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, annotation, defaultValue);
	}
}
