package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

public class PythonBinOp extends PythonExpression {

	private final PythonExpression left;
	private final PythonBinaryOperator operator;
	private final PythonExpression right;

	public PythonBinOp(SourceLocation location, PythonExpression left, PythonBinaryOperator operator,
	                   PythonExpression right) {
		super(location);
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public PythonExpression getLeft() {
		return left;
	}

	public PythonBinaryOperator getOperator() {
		return operator;
	}

	public PythonExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonBinOp that = (PythonBinOp) o;
		return Objects.equals(left, that.left) &&
				operator == that.operator &&
				Objects.equals(right, that.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operator, right);
	}
}
