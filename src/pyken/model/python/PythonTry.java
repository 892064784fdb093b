package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonTry extends PythonStatement {

	private final List<PythonStatement> body;
	private final List<PythonExceptHandler> handlers;
	private final List<PythonStatement> orElse;
	private final List<PythonStatement> finalBody;

	public PythonTry(SourceLocation location, List<PythonStatement> body, List<PythonExceptHandler> handlers,
	                 List<PythonStatement> orElse, List<PythonStatement> finalBody) {
		super(location);
		this.body = body;
		this.handlers = handlers;
		this.orElse = orElse;
		this.finalBody = finalBody;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	public List<PythonExceptHandler> getHandlers() {
		return handlers;
	}

	public List<PythonStatement> getOrElse() {
		return orElse;
	}

	public List<PythonStatement> getFinalBody() {
		return finalBody;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonTry pythonTry = (PythonTry) o;
		return Objects.equals(body, pythonTry.body) &&
				Objects.equals(handlers, pythonTry.handlers) &&
				Objects.equals(orElse, pythonTry.orElse) &&
				Objects.equals(finalBody, pythonTry.finalBody);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, handlers, orElse, finalBody);
	}
}
