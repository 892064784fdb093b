package pyken.trans.passes.declaration;

import pyken.model.declaration.Declaration;
import pyken.model.python.PythonModule;
import pyken.model.python.PythonStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the top-level statements of a module into declarations, keeping their order.
 */
public class DeclarationCollectionPass {

	private DeclarationCollectionPass() {}

	public static List<Declaration> perform(PythonModule module) {
		List<Declaration> declarations = new ArrayList<>();
		DeclarationCollectionVisitor visitor = new DeclarationCollectionVisitor();
		for (PythonStatement statement : module.getBody()) {
			declarations.addAll(statement.accept(visitor));
		}
		return declarations;
	}
}
