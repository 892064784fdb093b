package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.*;
import pyken.model.declaration.EntryPoint;
import pyken.model.declaration.ValidatorDeclaration;
import pyken.model.python.PythonComparisonOperator;
import pyken.model.type.TypeRegistry;
import pyken.util.SourceLocation;

public class ValidatorEmitterTest {

	@Test
	public void handlersAndCatchAll() {
		ValidatorDeclaration vault = new ValidatorDeclaration(SourceLocation.unknown(), "Vault",
				args(arg("owner", name("bytes"))),
				Arrays.asList(
						new EntryPoint(SourceLocation.unknown(), "spend",
								args(arg("datum"), arg("redeemer"), arg("ctx", name("Context"))),
								body(ret(compare(name("owner"), PythonComparisonOperator.IN,
										attr(attr("ctx", "transaction"), "signatories"))))),
						new EntryPoint(SourceLocation.unknown(), EntryPoint.CATCH_ALL,
								args(arg("ctx")),
								body(raise(null)))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		AikenValidator validator = ValidatorEmitter.emit(ctx, new TypeRegistry(), vault);
		assertThat(validator, is(new AikenValidator("Vault",
				Collections.singletonList(new AikenParameter("owner", "ByteArray")),
				Arrays.asList(
						new AikenHandler("spend", Arrays.asList(
								new AikenParameter("datum", "Option<Data>"),
								new AikenParameter("redeemer", "Data"),
								new AikenParameter("ctx", "ScriptContext")),
								Collections.singletonList(new AikenExpression(
										"list.has(ctx.transaction.signatories, owner)"))),
						new AikenHandler("else", Collections.singletonList(new AikenParameter("_", null)),
								Collections.singletonList(new AikenFail()))))));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void unannotatedHandlerParameterWarns() {
		ValidatorDeclaration minting = new ValidatorDeclaration(SourceLocation.unknown(), "Minting",
				Collections.emptyList(),
				Collections.singletonList(new EntryPoint(SourceLocation.unknown(), "mint",
						args(arg("_redeemer"), arg("policy_id"), arg("_")),
						body(ret(bool(true))))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		AikenValidator validator = ValidatorEmitter.emit(ctx, new TypeRegistry(), minting);
		assertThat(validator.getHandlers().get(0).getParameters(), is(Arrays.asList(
				new AikenParameter("_redeemer", "Data"),
				new AikenParameter("policy_id", "Data"),
				new AikenParameter("_", null))));
		assertThat(ctx.getWarnings().size(), is(1));
	}

}
