package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonAnnAssign extends PythonStatement {

	private final PythonExpression target;
	private final PythonExpression annotation;
	private final PythonExpression value;

	public PythonAnnAssign(SourceLocation location, PythonExpression target, PythonExpression annotation,
	                       PythonExpression value) {
		super(location);
		this.target = target;
		this.annotation = annotation;
		this.value = value;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getAnnotation() {
		return annotation;
	}

	/**
	 * @return the assigned value, or null for a bare declaration such as {@code x: int}
	 */
	public PythonExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAnnAssign that = (PythonAnnAssign) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, annotation, value);
	}
}
