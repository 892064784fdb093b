package pyken.model.type;

import java.util.Objects;

public class RecordField {

	private final String name;
	private final TypeSymbol type;

	public RecordField(String name, TypeSymbol type) {
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public TypeSymbol getType() {
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RecordField that = (RecordField) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}
}
