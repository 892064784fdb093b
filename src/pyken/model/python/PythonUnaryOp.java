package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonUnaryOp extends PythonExpression {

	private final PythonUnaryOperator operator;
	private final PythonExpression operand;

	public PythonUnaryOp(SourceLocation location, PythonUnaryOperator operator, PythonExpression operand) {
		super(location);
		this.operator = operator;
		this.operand = operand;
	}

	public PythonUnaryOperator getOperator() {
		return operator;
	}

	public PythonExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonUnaryOp that = (PythonUnaryOp) o;
		return operator == that.operator &&
				Objects.equals(operand, that.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}
}
