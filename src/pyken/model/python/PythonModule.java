package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonModule extends PythonNode {

	private final List<PythonStatement> body;

	public PythonModule(SourceLocation location, List<PythonStatement> body) {
		super(location);
		this.body = body;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonModule that = (PythonModule) o;
		return Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}
}
