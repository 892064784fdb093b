package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

/**
 * One arm of a when expression; several patterns are alternatives, written {@code A | B -> result}.
 */
public class AikenWhenArm extends AikenNode {

	public static final String WILDCARD = "_";

	private final List<String> patterns;
	private final String result;

	public AikenWhenArm(List<String> patterns, String result) {
		this.patterns = patterns;
		this.result = result;
	}

	public List<String> getPatterns() {
		return patterns;
	}

	public String getResult() {
		return result;
	}

	public boolean isWildcard() {
		return patterns.size() == 1 && WILDCARD.equals(patterns.get(0));
	}

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenWhenArm that = (AikenWhenArm) o;
		return Objects.equals(patterns, that.patterns) &&
				Objects.equals(result, that.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(patterns, result);
	}
}
