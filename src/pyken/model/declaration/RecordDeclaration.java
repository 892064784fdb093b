package pyken.model.declaration;

import pyken.model.python.PythonArgument;
import pyken.model.python.PythonStatement;
import pyken.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A data class. Depending on its shape it becomes a record with fields, an enumeration of nullary
 * constructors, or a single nullary constructor.
 */
public class RecordDeclaration extends Declaration {

	public enum Shape {
		FIELDS,
		ENUMERATION,
		NULLARY,
	}

	private final Shape shape;
	private final List<PythonArgument> fields;
	private final List<PythonStatement> fieldScope;
	private final List<String> variants;

	private RecordDeclaration(SourceLocation location, String name, Shape shape, List<PythonArgument> fields,
	                          List<PythonStatement> fieldScope, List<String> variants) {
		super(location, name);
		this.shape = shape;
		this.fields = fields;
		this.fieldScope = fieldScope;
		this.variants = variants;
	}

	/**
	 * @param fieldScope the statements searched for usage hints when a field has neither annotation
	 *                   nor default
	 */
	public static RecordDeclaration withFields(SourceLocation location, String name, List<PythonArgument> fields,
	                                           List<PythonStatement> fieldScope) {
		return new RecordDeclaration(location, name, Shape.FIELDS, fields, fieldScope, Collections.emptyList());
	}

	public static RecordDeclaration enumeration(SourceLocation location, String name, List<String> variants) {
		return new RecordDeclaration(location, name, Shape.ENUMERATION, Collections.emptyList(),
				Collections.emptyList(), variants);
	}

	public static RecordDeclaration nullary(SourceLocation location, String name) {
		return new RecordDeclaration(location, name, Shape.NULLARY, Collections.emptyList(),
				Collections.emptyList(), Collections.emptyList());
	}

	public Shape getShape() {
		return shape;
	}

	public List<PythonArgument> getFields() {
		return fields;
	}

	public List<PythonStatement> getFieldScope() {
		return fieldScope;
	}

	public List<String> getVariants() {
		return variants;
	}

	@Override
	public <T, E extends Throwable> T accept(DeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RecordDeclaration that = (RecordDeclaration) o;
		return shape == that.shape &&
				Objects.equals(getName(), that.getName()) &&
				Objects.equals(fields, that.fields) &&
				Objects.equals(fieldScope, that.fieldScope) &&
				Objects.equals(variants, that.variants);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), shape, fields, fieldScope, variants);
	}
}
