package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenTest;
import pyken.model.declaration.TestDeclaration;
import pyken.model.type.TypeRegistry;
import pyken.scope.NameScope;

/**
 * Emits a test function. Each test gets its own {@link NameScope}, so element renames made while
 * emitting one test are never visible in another.
 */
public class TestEmitter {

	private TestEmitter() {}

	public static AikenTest emit(IssueContext ctx, TypeRegistry registry, TestDeclaration test) {
		PythonStatementCodeGenVisitor body = new PythonStatementCodeGenVisitor(ctx, registry, new NameScope(), true);
		return new AikenTest(test.getName(), body.renderBody(test.getBody()));
	}
}
