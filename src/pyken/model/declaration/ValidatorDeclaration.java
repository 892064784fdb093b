package pyken.model.declaration;

import pyken.model.python.PythonArgument;
import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class ValidatorDeclaration extends Declaration {

	private final List<PythonArgument> parameters;
	private final List<EntryPoint> entryPoints;

	public ValidatorDeclaration(SourceLocation location, String name, List<PythonArgument> parameters,
	                            List<EntryPoint> entryPoints) {
		super(location, name);
		this.parameters = parameters;
		this.entryPoints = entryPoints;
	}

	/**
	 * @return the validator's own parameters, taken from {@code __init__}
	 */
	public List<PythonArgument> getParameters() {
		return parameters;
	}

	public List<EntryPoint> getEntryPoints() {
		return entryPoints;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ValidatorDeclaration that = (ValidatorDeclaration) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(entryPoints, that.entryPoints);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), parameters, entryPoints);
	}
}
