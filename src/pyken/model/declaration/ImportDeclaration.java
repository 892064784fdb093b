package pyken.model.declaration;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An imported module path, written with slashes, with either an alias or a list of imported names.
 */
public class ImportDeclaration extends Declaration {

	private final String alias;
	private final List<String> names;

	public ImportDeclaration(SourceLocation location, String module, String alias, List<String> names) {
		super(location, module);
		this.alias = alias;
		this.names = names;
	}

	public String getModule() {
		return getName();
	}

	public String getAlias() {
		return alias;
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ImportDeclaration that = (ImportDeclaration) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(alias, that.alias) &&
				Objects.equals(names, that.names);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), alias, names);
	}
}
