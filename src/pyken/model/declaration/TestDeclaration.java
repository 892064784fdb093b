package pyken.model.declaration;

import pyken.model.python.PythonStatement;
import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A test function. The name is the emitted one, without the {@code test_} prefix.
 */
public class TestDeclaration extends Declaration {

	private final List<PythonStatement> body;

	public TestDeclaration(SourceLocation location, String name, List<PythonStatement> body) {
		super(location, name);
		this.body = body;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TestDeclaration that = (TestDeclaration) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), body);
	}
}
