package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonFunctionDef extends PythonStatement {

	private final String name;
	private final List<PythonArgument> arguments;
	private final PythonExpression returns;
	private final List<PythonExpression> decorators;
	private final List<PythonStatement> body;

	public PythonFunctionDef(SourceLocation location, String name, List<PythonArgument> arguments,
	                         PythonExpression returns, List<PythonExpression> decorators,
	                         List<PythonStatement> body) {
		super(location);
		this.name = name;
		this.arguments = arguments;
		this.returns = returns;
		this.decorators = decorators;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<PythonArgument> getArguments() {
		return arguments;
	}

	/**
	 * @return the return annotation, or null when there is none
	 */
	public PythonExpression getReturns() {
		return returns;
	}

	public List<PythonExpression> getDecorators() {
		return decorators;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonFunctionDef that = (PythonFunctionDef) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(returns, that.returns) &&
				Objects.equals(decorators, that.decorators) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments, returns, decorators, body);
	}
}
