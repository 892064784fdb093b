package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code from module import a, b as c}. The module is null for {@code from . import x}.
 */
public class PythonImportFrom extends PythonStatement {

	private final String module;
	private final List<PythonAlias> aliases;

	public PythonImportFrom(SourceLocation location, String module, List<PythonAlias> aliases) {
		super(location);
		this.module = module;
		this.aliases = aliases;
	}

	public String getModule() {
		return module;
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
		PythonImportFrom that = (PythonImportFrom) o;
		return Objects.equals(module, that.module) &&
				Objects.equals(aliases, that.aliases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, aliases);
	}
}
