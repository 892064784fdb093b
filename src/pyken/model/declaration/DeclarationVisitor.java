package pyken.model.declaration;

public abstract class DeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(ImportDeclaration importDeclaration) throws E;
	public abstract T visit(RecordDeclaration recordDeclaration) throws E;
	public abstract T visit(ValidatorDeclaration validatorDeclaration) throws E;
	public abstract T visit(FunctionDeclaration functionDeclaration) throws E;
	public abstract T visit(TestDeclaration testDeclaration) throws E;
	public abstract T visit(ConstantDeclaration constantDeclaration) throws E;
	public abstract T visit(UnsupportedDeclaration unsupportedDeclaration) throws E;
}
