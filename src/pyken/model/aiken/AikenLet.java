package pyken.model.aiken;

import java.util.Objects;

public class AikenLet extends AikenStatement {

	private final String pattern;
	private final String value;

	public AikenLet(String pattern, String value) {
		this.pattern = pattern;
		this.value = value;
	}

	public String getPattern() {
		return pattern;
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
		AikenLet aikenLet = (AikenLet) o;
		return Objects.equals(pattern, aikenLet.pattern) &&
				Objects.equals(value, aikenLet.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, value);
	}
}
