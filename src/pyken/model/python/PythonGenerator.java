package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One {@code for target in iterable if cond...} clause of a comprehension.
 */
public class PythonGenerator extends PythonNode {

	private final PythonExpression target;
	private final PythonExpression iterable;
	private final List<PythonExpression> conditions;

	public PythonGenerator(SourceLocation location, PythonExpression target, PythonExpression iterable,
	                       List<PythonExpression> conditions) {
		super(location);
		this.target = target;
		this.iterable = iterable;
		this.conditions = conditions;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getIterable() {
		return iterable;
	}

	public List<PythonExpression> getConditions() {
		return conditions;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonGenerator that = (PythonGenerator) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(iterable, that.iterable) &&
				Objects.equals(conditions, that.conditions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, iterable, conditions);
	}
}
