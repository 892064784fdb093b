package pyken.model.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The fields of one emitted record type, in constructor parameter order.
 */
public class TypeRecord {

	private final String name;
	private final List<RecordField> fields;

	public TypeRecord(String name, List<RecordField> fields) {
		this.name = name;
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
	}

	public String getName() {
		return name;
	}

	public List<RecordField> getFields() {
		return fields;
	}

	public List<String> getFieldNames() {
		List<String> names = new ArrayList<>();
		for (RecordField field : fields) {
			names.add(field.getName());
		}
		return names;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypeRecord that = (TypeRecord) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, fields);
	}
}
