package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonExceptHandler extends PythonNode {

	private final PythonExpression type;
	private final String name;
	private final List<PythonStatement> body;

	public PythonExceptHandler(SourceLocation location, PythonExpression type, String name,
	                           List<PythonStatement> body) {
		super(location);
		this.type = type;
		this.name = name;
		this.body = body;
	}

	public PythonExpression getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonExceptHandler that = (PythonExceptHandler) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(name, that.name) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, name, body);
	}
}
