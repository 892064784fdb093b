package pyken.model.aiken;

/**
 * A top-level item of an Aiken module
 *
 */
public abstract class AikenDeclaration extends AikenNode {

	public abstract <T, E extends Throwable> T accept(AikenDeclarationVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
