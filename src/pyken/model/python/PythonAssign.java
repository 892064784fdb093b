package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonAssign extends PythonStatement {

	private final List<PythonExpression> targets;
	private final PythonExpression value;

	public PythonAssign(SourceLocation location, List<PythonExpression> targets, PythonExpression value) {
		super(location);
		this.targets = targets;
		this.value = value;
	}

	public List<PythonExpression> getTargets() {
		return targets;
	}

	public PythonExpression getValue() {
		return value;
	}

	/**
	 * @return the assigned name if this is a plain {@code name = value}, null otherwise
	 */
	public String getSingleTargetName() {
		if (targets.size() == 1 && targets.get(0) instanceof PythonName) {
			return ((PythonName) targets.get(0)).getId();
		}
		return null;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAssign that = (PythonAssign) o;
		return Objects.equals(targets, that.targets) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(targets, value);
	}
}
