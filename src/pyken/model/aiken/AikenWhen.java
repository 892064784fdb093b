package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenWhen extends AikenStatement {

	private final String subject;
	private final List<AikenWhenArm> arms;

	public AikenWhen(String subject, List<AikenWhenArm> arms) {
		this.subject = subject;
		this.arms = arms;
	}

	public String getSubject() {
		return subject;
	}

	public List<AikenWhenArm> getArms() {
		return arms;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenWhen aikenWhen = (AikenWhen) o;
		return Objects.equals(subject, aikenWhen.subject) &&
				Objects.equals(arms, aikenWhen.arms);
	}

	@Override
	public int hashCode() {
		return Objects.hash(subject, arms);
	}
}
