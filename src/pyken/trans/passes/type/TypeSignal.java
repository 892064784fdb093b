package pyken.trans.passes.type;

import pyken.model.python.PythonExpression;
import pyken.model.python.PythonStatement;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything type resolution may look at for one parameter or field: its annotation and default value
 * (either may be null) and the statements in which its uses are scanned.
 */
public class TypeSignal {

	private final String name;
	private final PythonExpression annotation;
	private final PythonExpression defaultValue;
	private final List<PythonStatement> scope;

	public TypeSignal(String name, PythonExpression annotation, PythonExpression defaultValue,
	                  List<PythonStatement> scope) {
		this.name = name;
		this.annotation = annotation;
		this.defaultValue = defaultValue;
		this.scope = scope;
	}

	public static TypeSignal annotationOnly(String name, PythonExpression annotation) {
		return new TypeSignal(name, annotation, null, Collections.emptyList());
	}

	public String getName() {
		return name;
	}

	public PythonExpression getAnnotation() {
		return annotation;
	}

	public PythonExpression getDefaultValue() {
		return defaultValue;
	}

	public List<PythonStatement> getScope() {
		return scope;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypeSignal that = (TypeSignal) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(defaultValue, that.defaultValue) &&
				Objects.equals(scope, that.scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, annotation, defaultValue, scope);
	}
}
