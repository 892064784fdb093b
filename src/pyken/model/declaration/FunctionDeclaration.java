package pyken.model.declaration;

import pyken.model.python.PythonArgument;
import pyken.model.python.PythonExpression;
import pyken.model.python.PythonStatement;
import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class FunctionDeclaration extends Declaration {

	private final List<PythonArgument> arguments;
	private final PythonExpression returns;
	private final List<PythonStatement> body;

	public FunctionDeclaration(SourceLocation location, String name, List<PythonArgument> arguments,
	                           PythonExpression returns, List<PythonStatement> body) {
		super(location, name);
		this.arguments = arguments;
		this.returns = returns;
		this.body = body;
	}

	public List<PythonArgument> getArguments() {
		return arguments;
	}

	/**
	 * @return the return annotation, or null
	 */
	public PythonExpression getReturns() {
		return returns;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FunctionDeclaration that = (FunctionDeclaration) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(returns, that.returns) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), arguments, returns, body);
	}
}
