package pyken.model.python;

import pyken.util.SourceLocatable;
import pyken.util.SourceLocation;

/**
 * Base of the Python syntax tree handed over by the parser. Source locations are carried along for
 * diagnostics but are never part of node equality.
 */
public abstract class PythonNode extends SourceLocatable {

	private final SourceLocation location;

	public PythonNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

}
