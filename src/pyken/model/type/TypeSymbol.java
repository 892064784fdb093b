package pyken.model.type;

import java.util.Objects;

/**
 * A resolved Aiken type name, tagged with how it was found.
 */
public class TypeSymbol {

	public static final String WILDCARD = "Data";

	private final String name;
	private final TypeProvenance provenance;

	public TypeSymbol(String name, TypeProvenance provenance) {
		this.name = name;
		this.provenance = provenance;
	}

	public static TypeSymbol wildcard() {
		return new TypeSymbol(WILDCARD, TypeProvenance.FALLBACK);
	}

	public String getName() {
		return name;
	}

	public TypeProvenance getProvenance() {
		return provenance;
	}

	public boolean isWildcard() {
		return WILDCARD.equals(name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypeSymbol that = (TypeSymbol) o;
		return Objects.equals(name, that.name) &&
				provenance == that.provenance;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, provenance);
	}

	@Override
	public String toString() {
		return name + " (" + provenance + ")";
	}
}
