package pyken.model.aiken;

import java.util.Objects;

/**
 * A bare expression line, already rendered to text.
 */
public class AikenExpression extends AikenStatement {

	private final String code;

	public AikenExpression(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenExpression that = (AikenExpression) o;
		return Objects.equals(code, that.code);
	}

	@Override
	public int hashCode() {
		return Objects.hash(code);
	}
}
