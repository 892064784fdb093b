package pyken.model.type;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records emitted so far in the current module. Later declarations look records up here when they
 * destructure or match on a value of that type.
 */
public class TypeRegistry {

	private final Map<String, TypeRecord> records;

	public TypeRegistry() {
		this.records = new HashMap<>();
	}

	public void addRecord(TypeRecord record) {
		records.put(record.getName(), record);
	}

	public Optional<TypeRecord> findRecord(String name) {
		return Optional.ofNullable(records.get(name));
	}

	/**
	 * @return whether a record of this name is known and has at least one field
	 */
	public boolean hasFields(String name) {
		TypeRecord record = records.get(name);
		return record != null && !record.getFields().isEmpty();
	}
}
