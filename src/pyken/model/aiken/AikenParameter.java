package pyken.model.aiken;

import java.util.Objects;

/**
 * A function, handler or validator parameter. The type is null for an untyped parameter such as
 * {@code _}.
 */
public class AikenParameter extends AikenNode {

	private final String name;
	private final String type;

	public AikenParameter(String name, String type) {
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenParameter that = (AikenParameter) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}
}
