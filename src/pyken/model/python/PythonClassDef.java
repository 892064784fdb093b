package pyken.model.python;

import pyken.util.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class PythonClassDef extends PythonStatement {

	private final String name;
	private final List<PythonExpression> bases;
	private final List<PythonExpression> decorators;
	private final List<PythonStatement> body;

	public PythonClassDef(SourceLocation location, String name, List<PythonExpression> bases,
	                      List<PythonExpression> decorators, List<PythonStatement> body) {
		super(location);
		this.name = name;
		this.bases = bases;
		this.decorators = decorators;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<PythonExpression> getBases() {
		return bases;
	}

	public List<PythonExpression> getDecorators() {
		return decorators;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	/**
	 * @return the first method defined directly in the class body with the given name
	 */
	public Optional<PythonFunctionDef> findMethod(String methodName) {
		for (PythonStatement stmt : body) {
			if (stmt instanceof PythonFunctionDef && ((PythonFunctionDef) stmt).getName().equals(methodName)) {
				return Optional.of((PythonFunctionDef) stmt);
			}
		}
		return Optional.empty();
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonClassDef that = (PythonClassDef) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(bases, that.bases) &&
				Objects.equals(decorators, that.decorators) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, bases, decorators, body);
	}
}
