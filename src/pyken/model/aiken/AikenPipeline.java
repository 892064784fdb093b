package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenPipeline extends AikenStatement {

	private final String base;
	private final List<String> stages;

	public AikenPipeline(String base, List<String> stages) {
		this.base = base;
		this.stages = stages;
	}

	public String getBase() {
		return base;
	}

	public List<String> getStages() {
		return stages;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenPipeline that = (AikenPipeline) o;
		return Objects.equals(base, that.base) &&
				Objects.equals(stages, that.stages);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, stages);
	}
}
