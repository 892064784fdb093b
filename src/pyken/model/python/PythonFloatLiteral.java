package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.Objects;

/**
 * A floating-point literal, kept as its numeral text.
 */
public class PythonFloatLiteral extends PythonExpression {

	private final String text;

	public PythonFloatLiteral(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonFloatLiteral that = (PythonFloatLiteral) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
