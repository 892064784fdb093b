package pyken.model.declaration;

import pyken.model.python.PythonExpression;
import pyken.util.SourceLocation;

import java.util.Objects;

public class ConstantDeclaration extends Declaration {

	private final PythonExpression annotation;
	private final PythonExpression value;

	public ConstantDeclaration(SourceLocation location, String name, PythonExpression annotation,
	                           PythonExpression value) {
		super(location, name);
		this.annotation = annotation;
		this.value = value;
	}

	public PythonExpression getAnnotation() {
		return annotation;
	}

	public PythonExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConstantDeclaration that = (ConstantDeclaration) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), annotation, value);
	}
}
