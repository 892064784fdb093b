package pyken.model.aiken;

public abstract class AikenNodeVisitor<T, E extends Throwable> {

	public abstract T visit(AikenModule module) throws E;
	public abstract T visit(AikenDeclaration declaration) throws E;
	public abstract T visit(AikenStatement statement) throws E;
	public abstract T visit(AikenConstructor constructor) throws E;
	public abstract T visit(AikenField field) throws E;
	public abstract T visit(AikenParameter parameter) throws E;
	public abstract T visit(AikenHandler handler) throws E;
	public abstract T visit(AikenWhenArm whenArm) throws E;
}
