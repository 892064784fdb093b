package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonImport extends PythonStatement {

	private final List<PythonAlias> aliases;

	public PythonImport(SourceLocation location, List<PythonAlias> aliases) {
		super(location);
		this.aliases = aliases;
	}

	public List<PythonAlias> getAliases() {
		return aliases;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonImport that = (PythonImport) o;
		return Objects.equals(aliases, that.aliases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(aliases);
	}
}
