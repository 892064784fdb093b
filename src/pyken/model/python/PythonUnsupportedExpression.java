package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * Any expression kind without a translation rule, such as lambdas or f-strings. Only the parser's
 * node kind name is kept.
 */
public class PythonUnsupportedExpression extends PythonExpression {

	private final String kind;

	public PythonUnsupportedExpression(SourceLocation location, String kind) {
		super(location);
		this.kind = kind;
	}

	public String getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonUnsupportedExpression that = (PythonUnsupportedExpression) o;
		return Objects.equals(kind, that.kind);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind);
	}
}
