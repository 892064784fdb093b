package pyken.model.aiken;

public abstract class AikenStatementVisitor<T, E extends Throwable> {

	public abstract T visit(AikenLet let) throws E;
	public abstract T visit(AikenRecordDestructure recordDestructure) throws E;
	public abstract T visit(AikenExpect expect) throws E;
	public abstract T visit(AikenWhen when) throws E;
	public abstract T visit(AikenIf anIf) throws E;
	public abstract T visit(AikenPipeline pipeline) throws E;
	public abstract T visit(AikenFail fail) throws E;
	public abstract T visit(AikenExpression expression) throws E;
}
