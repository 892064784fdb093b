package pyken.model.aiken;

/**
 * One line, or one multi-line construct, inside an Aiken block. The last statement of a block is
 * its value.
 *
 */
public abstract class AikenStatement extends AikenNode {

	public abstract <T, E extends Throwable> T accept(AikenStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
