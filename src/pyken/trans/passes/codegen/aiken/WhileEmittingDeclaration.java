package pyken.trans.passes.codegen.aiken;

import pyken.errors.Context;
import pyken.errors.ContextVisitor;
import pyken.util.SourceLocation;

public class WhileEmittingDeclaration extends Context {

	private final String name;
	private final SourceLocation location;

	public WhileEmittingDeclaration(String name, SourceLocation location) {
		this.name = name;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
