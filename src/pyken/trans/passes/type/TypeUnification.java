package pyken.trans.passes.type;

import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;

public class TypeUnification {

	private TypeUnification() {}

	/**
	 * Combines two independently inferred types. Equal types unify to themselves and the wildcard
	 * yields to the other side. Any other pair has no consensus and degrades to the wildcard.
	 */
	public static TypeSymbol unify(TypeSymbol t1, TypeSymbol t2) {
		if (t1.getName().equals(t2.getName())) {
			return t1;
		}
		if (t1.isWildcard()) {
			return t2;
		}
		if (t2.isWildcard()) {
			return t1;
		}
		return new TypeSymbol(TypeSymbol.WILDCARD, TypeProvenance.FALLBACK);
	}
}
