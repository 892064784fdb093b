package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenConstructor extends AikenNode {

	private final String name;
	private final List<AikenField> fields;

	public AikenConstructor(String name, List<AikenField> fields) {
		this.name = name;
		this.fields = fields;
	}

	public String getName() {
		return name;
	}

	public List<AikenField> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenConstructor that = (AikenConstructor) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, fields);
	}
}
