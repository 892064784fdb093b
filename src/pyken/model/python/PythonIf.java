package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An if statement. An elif chain is an else branch holding exactly one nested PythonIf.
 */
public class PythonIf extends PythonStatement {

	private final PythonExpression test;
	private final List<PythonStatement> body;
	private final List<PythonStatement> orElse;

	public PythonIf(SourceLocation location, PythonExpression test, List<PythonStatement> body,
	                List<PythonStatement> orElse) {
		super(location);
		this.test = test;
		this.body = body;
		this.orElse = orElse;
	}

	public PythonExpression getTest() {
		return test;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	public List<PythonStatement> getOrElse() {
		return orElse;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonIf pythonIf = (PythonIf) o;
		return Objects.equals(test, pythonIf.test) &&
				Objects.equals(body, pythonIf.body) &&
				Objects.equals(orElse, pythonIf.orElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, body, orElse);
	}
}
