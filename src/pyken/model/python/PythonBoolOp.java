package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonBoolOp extends PythonExpression {

	private final PythonBooleanOperator operator;
	private final List<PythonExpression> values;

	public PythonBoolOp(SourceLocation location, PythonBooleanOperator operator, List<PythonExpression> values) {
		super(location);
		this.operator = operator;
		this.values = values;
	}

	public PythonBooleanOperator getOperator() {
		return operator;
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
		PythonBoolOp that = (PythonBoolOp) o;
		return operator == that.operator &&
				Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, values);
	}
}
