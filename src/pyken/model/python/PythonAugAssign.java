package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonAugAssign extends PythonStatement {

	private final PythonExpression target;
	private final PythonBinaryOperator operator;
	private final PythonExpression value;

	public PythonAugAssign(SourceLocation location, PythonExpression target, PythonBinaryOperator operator,
	                       PythonExpression value) {
		super(location);
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonBinaryOperator getOperator() {
		return operator;
	}

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
		PythonAugAssign that = (PythonAugAssign) o;
		return Objects.equals(target, that.target) &&
				operator == that.operator &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, operator, value);
	}
}
