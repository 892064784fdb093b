package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * Any statement kind without a translation rule, such as loops or with-blocks. Only the parser's
 * node kind name is kept.
 */
public class PythonUnsupportedStatement extends PythonStatement {

	private final String kind;

	public PythonUnsupportedStatement(SourceLocation location, String kind) {
		super(location);
		this.kind = kind;
	}

	public String getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonUnsupportedStatement that = (PythonUnsupportedStatement) o;
		return Objects.equals(kind, that.kind);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind);
	}
}
