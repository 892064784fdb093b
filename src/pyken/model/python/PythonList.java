package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonList extends PythonExpression {

	private final List<PythonExpression> elements;

	public PythonList(SourceLocation location, List<PythonExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<PythonExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonList that = (PythonList) o;
		return Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}
}
