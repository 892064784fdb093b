package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonCall extends PythonExpression {

	private final PythonExpression function;
	private final List<PythonExpression> arguments;
	private final List<PythonKeyword> keywords;

	public PythonCall(SourceLocation location, PythonExpression function, List<PythonExpression> arguments,
	                  List<PythonKeyword> keywords) {
		super(location);
		this.function = function;
		this.arguments = arguments;
		this.keywords = keywords;
	}

	public PythonExpression getFunction() {
		return function;
	}

	public List<PythonExpression> getArguments() {
		return arguments;
	}

	public List<PythonKeyword> getKeywords() {
		return keywords;
	}

	/**
	 * @return the simple name of the callee: the identifier of a plain name, or the attribute name of an
	 * attribute access; null for any other callee shape
	 */
	public String getCalleeName() {
		if (function instanceof PythonName) {
			return ((PythonName) function).getId();
		}
		if (function instanceof PythonAttribute) {
			return ((PythonAttribute) function).getAttribute();
		}
		return null;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonCall that = (PythonCall) o;
		return Objects.equals(function, that.function) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(keywords, that.keywords);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments, keywords);
	}
}
