package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

/**
 * The if expression. An empty else branch is not written.
 */
public class AikenIf extends AikenStatement {

	private final String condition;
	private final List<AikenStatement> then;
	private final List<AikenStatement> orElse;

	public AikenIf(String condition, List<AikenStatement> then, List<AikenStatement> orElse) {
		this.condition = condition;
		this.then = then;
		this.orElse = orElse;
	}

	public String getCondition() {
		return condition;
	}

	public List<AikenStatement> getThen() {
		return then;
	}

	public List<AikenStatement> getElse() {
		return orElse;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenIf aikenIf = (AikenIf) o;
		return Objects.equals(condition, aikenIf.condition) &&
				Objects.equals(then, aikenIf.then) &&
				Objects.equals(orElse, aikenIf.orElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, then, orElse);
	}
}
