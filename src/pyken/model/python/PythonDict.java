package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A dict display. Keys and values are parallel lists; a null key stands for {@code **mapping}
 * unpacking.
 */
public class PythonDict extends PythonExpression {

	private final List<PythonExpression> keys;
	private final List<PythonExpression> values;

	public PythonDict(SourceLocation location, List<PythonExpression> keys, List<PythonExpression> values) {
		super(location);
		this.keys = keys;
		this.values = values;
	}

	public List<PythonExpression> getKeys() {
		return keys;
	}

	public List<PythonExpression> getValues() {
		return values;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonDict that = (PythonDict) o;
		return Objects.equals(keys, that.keys) &&
				Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keys, values);
	}
}
