package pyken.model.aiken;

public class AikenFail extends AikenStatement {

	@Override
	public <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return AikenFail.class.hashCode();
	}
}
