package pyken.model.declaration;

import pyken.model.python.PythonArgument;
import pyken.model.python.PythonStatement;
import pyken.util.SourceLocatable;
import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One handler method of a validator, with the leading self parameter already removed.
 */
public class EntryPoint extends SourceLocatable {

	public static final String CATCH_ALL = "else_";

	private final SourceLocation location;
	private final String name;
	private final List<PythonArgument> parameters;
	private final List<PythonStatement> body;

	public EntryPoint(SourceLocation location, String name, List<PythonArgument> parameters,
	                  List<PythonStatement> body) {
		this.location = location;
		this.name = name;
		this.parameters = parameters;
		this.body = body;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	public List<PythonArgument> getParameters() {
		return parameters;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	public boolean isCatchAll() {
		return CATCH_ALL.equals(name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EntryPoint that = (EntryPoint) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, body);
	}
}
