package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenDeclaration;
import pyken.model.aiken.AikenModule;
import pyken.model.declaration.Declaration;
import pyken.model.python.PythonModule;
import pyken.model.type.TypeRegistry;
import pyken.trans.passes.declaration.DeclarationCollectionPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a Python module into an Aiken module, one declaration at a time and in source order.
 * Records emitted earlier are visible to the declarations after them.
 */
public class AikenCodeGenPass {

	private AikenCodeGenPass() {}

	public static AikenModule perform(IssueContext ctx, PythonModule module) {
		TypeRegistry registry = new TypeRegistry();
		List<AikenDeclaration> declarations = new ArrayList<>();
		for (Declaration declaration : DeclarationCollectionPass.perform(module)) {
			IssueContext declarationCtx = ctx.withContext(
					new WhileEmittingDeclaration(declaration.getName(), declaration.getLocation()));
			declarations.add(declaration.accept(new DeclarationCodeGenVisitor(declarationCtx, registry)));
		}
		return new AikenModule(declarations);
	}
}
