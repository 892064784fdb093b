package pyken.model.declaration;

import pyken.util.SourceLocatable;
import pyken.util.SourceLocation;

/**
 * One top-level unit of a Python module, classified by what it becomes in Aiken.
 */
public abstract class Declaration extends SourceLocatable {

	private final SourceLocation location;
	private final String name;

	public Declaration(SourceLocation location, String name) {
		this.location = location;
		this.name = name;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	public abstract <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E;
}
