package pyken.model.declaration;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * A top-level statement that has no Aiken counterpart. The name is the statement kind.
 */
public class UnsupportedDeclaration extends Declaration {

	public UnsupportedDeclaration(SourceLocation location, String kind) {
		super(location, kind);
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(getName(), ((UnsupportedDeclaration) o).getName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName());
	}
}
