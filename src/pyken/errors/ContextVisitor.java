package pyken.errors;

import pyken.trans.passes.codegen.aiken.WhileEmittingDeclaration;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileEmittingDeclaration whileEmittingDeclaration) throws E;

}
