package pyken.trans.passes.type;

import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;

/**
 * Resolves the Aiken type of a parameter or field. The signals are tried in order: explicit
 * annotation, literal default value, heuristic scan of the enclosing body, and finally the
 * {@code is_} naming convention for booleans. When nothing matches the result is the wildcard.
 */
public class TypeResolver {

	private TypeResolver() {}

	public static TypeSymbol resolve(TypeSignal signal) {
		if (signal.getAnnotation() != null) {
			return new TypeSymbol(PythonTypeTable.annotationType(signal.getAnnotation()), TypeProvenance.ANNOTATION);
		}
		if (signal.getDefaultValue() != null) {
			String type = signal.getDefaultValue().accept(new LiteralTypeVisitor());
			if (type != null) {
				return new TypeSymbol(type, TypeProvenance.DEFAULT_VALUE);
			}
		}
		String scanned = ParameterUsageScan.scan(signal.getName(), signal.getScope());
		if (scanned != null) {
			return new TypeSymbol(scanned, TypeProvenance.HEURISTIC);
		}
		if (signal.getName().startsWith("is_")) {
			return new TypeSymbol("Bool", TypeProvenance.HEURISTIC);
		}
		return TypeSymbol.wildcard();
	}
}
