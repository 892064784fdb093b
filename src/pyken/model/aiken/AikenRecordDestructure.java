package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

/**
 * {@code let Ctor { a, b } = value}. A null field list destructures with the open pattern
 * {@code { .. }}.
 */
public class AikenRecordDestructure extends AikenStatement {

	private final String constructor;
	private final List<String> fields;
	private final String value;

	public AikenRecordDestructure(String constructor, List<String> fields, String value) {
		this.constructor = constructor;
		this.fields = fields;
		this.value = value;
	}

	public String getConstructor() {
		return constructor;
	}

	public List<String> getFields() {
		return fields;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenRecordDestructure that = (AikenRecordDestructure) o;
		return Objects.equals(constructor, that.constructor) &&
				Objects.equals(fields, that.fields) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constructor, fields, value);
	}
}
