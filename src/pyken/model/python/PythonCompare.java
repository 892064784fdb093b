package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A possibly chained comparison {@code left op1 c1 op2 c2 ...}; operators and comparators have equal
 * length.
 */
public class PythonCompare extends PythonExpression {

	private final PythonExpression left;
	private final List<PythonComparisonOperator> operators;
	private final List<PythonExpression> comparators;

	public PythonCompare(SourceLocation location, PythonExpression left, List<PythonComparisonOperator> operators,
	                     List<PythonExpression> comparators) {
		super(location);
		this.left = left;
		this.operators = operators;
		this.comparators = comparators;
	}

	public PythonExpression getLeft() {
		return left;
	}

	public List<PythonComparisonOperator> getOperators() {
		return operators;
	}

	public List<PythonExpression> getComparators() {
		return comparators;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonCompare that = (PythonCompare) o;
		return Objects.equals(left, that.left) &&
				Objects.equals(operators, that.operators) &&
				Objects.equals(comparators, that.comparators);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operators, comparators);
	}
}
