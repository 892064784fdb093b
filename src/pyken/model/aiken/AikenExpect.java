package pyken.model.aiken;

import java.util.Objects;

/**
 * {@code expect pattern = value}, or {@code expect value} when the pattern is null.
 */
public class AikenExpect extends AikenStatement {

	private final String pattern;
	private final String value;

	public AikenExpect(String pattern, String value) {
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
		AikenExpect that = (AikenExpect) o;
		return Objects.equals(pattern, that.pattern) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, value);
	}
}
