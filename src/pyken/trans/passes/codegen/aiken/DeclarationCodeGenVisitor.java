package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenComment;
import pyken.model.aiken.AikenConstant;
import pyken.model.aiken.AikenDeclaration;
import pyken.model.aiken.AikenUse;
import pyken.model.declaration.*;
import pyken.model.type.TypeRegistry;
import pyken.scope.NameScope;
import pyken.trans.passes.type.PythonTypeTable;

public class DeclarationCodeGenVisitor extends DeclarationVisitor<AikenDeclaration, RuntimeException> {

	private final IssueContext ctx;
	private final TypeRegistry registry;

	public DeclarationCodeGenVisitor(IssueContext ctx, TypeRegistry registry) {
		this.ctx = ctx;
		this.registry = registry;
	}

	@Override
	public AikenDeclaration visit(ImportDeclaration importDeclaration) throws RuntimeException {
		return new AikenUse(importDeclaration.getModule(), importDeclaration.getAlias(), importDeclaration.getNames());
	}

	@Override
	public AikenDeclaration visit(RecordDeclaration recordDeclaration) throws RuntimeException {
		return RecordEmitter.emit(ctx, registry, recordDeclaration);
	}

	@Override
	public AikenDeclaration visit(ValidatorDeclaration validatorDeclaration) throws RuntimeException {
		return ValidatorEmitter.emit(ctx, registry, validatorDeclaration);
	}

	@Override
	public AikenDeclaration visit(FunctionDeclaration functionDeclaration) throws RuntimeException {
		return FunctionEmitter.emit(ctx, registry, functionDeclaration);
	}

	@Override
	public AikenDeclaration visit(TestDeclaration testDeclaration) throws RuntimeException {
		return TestEmitter.emit(ctx, registry, testDeclaration);
	}

	@Override
	public AikenDeclaration visit(ConstantDeclaration constantDeclaration) throws RuntimeException {
		String type = null;
		if (constantDeclaration.getAnnotation() != null) {
			type = PythonTypeTable.annotationType(constantDeclaration.getAnnotation());
		}
		String value = constantDeclaration.getValue().accept(new PythonExpressionCodeGenVisitor(ctx, new NameScope()));
		return new AikenConstant(constantDeclaration.getName(), type, value);
	}

	@Override
	public AikenDeclaration visit(UnsupportedDeclaration unsupportedDeclaration) throws RuntimeException {
		ctx.warn(new UnsupportedConstructIssue(unsupportedDeclaration.getName(), unsupportedDeclaration.getLocation()));
		return new AikenComment("unsupported declaration");
	}
}
