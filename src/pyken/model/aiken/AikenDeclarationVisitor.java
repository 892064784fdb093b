package pyken.model.aiken;

public abstract class AikenDeclarationVisitor<T, E extends Throwable> {

	public abstract T visit(AikenUse use) throws E;
	public abstract T visit(AikenTypeDefinition typeDefinition) throws E;
	public abstract T visit(AikenValidator validator) throws E;
	public abstract T visit(AikenFunction function) throws E;
	public abstract T visit(AikenTest test) throws E;
	public abstract T visit(AikenConstant constant) throws E;
	public abstract T visit(AikenComment comment) throws E;
}
