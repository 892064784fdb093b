package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A list comprehension or generator expression.
 */
public class PythonComprehension extends PythonExpression {

	public enum Kind {
		LIST,
		GENERATOR,
	}

	private final Kind kind;
	private final PythonExpression element;
	private final List<PythonGenerator> generators;

	public PythonComprehension(SourceLocation location, Kind kind, PythonExpression element,
	                           List<PythonGenerator> generators) {
		super(location);
		this.kind = kind;
		this.element = element;
		this.generators = generators;
	}

	public Kind getKind() {
		return kind;
	}

	public PythonExpression getElement() {
		return element;
	}

	public List<PythonGenerator> getGenerators() {
		return generators;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonComprehension that = (PythonComprehension) o;
		return kind == that.kind &&
				Objects.equals(element, that.element) &&
				Objects.equals(generators, that.generators);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, element, generators);
	}
}
