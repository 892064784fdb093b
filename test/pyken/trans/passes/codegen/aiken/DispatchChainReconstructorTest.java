package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.AikenWhen;
import pyken.model.aiken.AikenWhenArm;
import pyken.model.python.PythonComparisonOperator;
import pyken.model.python.PythonIf;
import pyken.model.type.RecordField;
import pyken.model.type.TypeRecord;
import pyken.model.type.TypeRegistry;
import pyken.model.type.TypeSymbol;
import pyken.scope.NameScope;

public class DispatchChainReconstructorTest {

	private static AikenWhen reconstruct(TopLevelIssueContext ctx, TypeRegistry registry, PythonIf head) {
		return DispatchChainReconstructor.reconstruct(ctx, registry, new NameScope(), head);
	}

	@Test
	public void isinstanceChainWithElse() {
		// if isinstance(x, A): return "one"
		// elif isinstance(x, B): return "two"
		// else: return "zero"
		PythonIf chain = ifStmt(isinstance("x", name("A")), body(ret(str("one"))), body(
				ifStmt(isinstance("x", name("B")), body(ret(str("two"))), body(ret(str("zero"))))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		AikenWhen when = reconstruct(ctx, new TypeRegistry(), chain);
		assertThat(when, is(new AikenWhen("x", Arrays.asList(
				new AikenWhenArm(Collections.singletonList("A"), "\"one\""),
				new AikenWhenArm(Collections.singletonList("B"), "\"two\""),
				new AikenWhenArm(Collections.singletonList("_"), "\"zero\"")))));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void noWildcardWithoutElse() {
		PythonIf chain = ifStmt(isinstance("x", name("A")), body(ret(num(1))), body(
				ifStmt(isinstance("x", name("B")), ret(num(2)))));
		AikenWhen when = reconstruct(new TopLevelIssueContext(), new TypeRegistry(), chain);
		assertThat(when.getArms().size(), is(2));
		for (AikenWhenArm arm : when.getArms()) {
			assertFalse(arm.isWildcard());
		}
	}

	@Test
	public void membershipWithAlternativesAndFields() {
		TypeRegistry registry = new TypeRegistry();
		registry.addRecord(new TypeRecord("Pay", Collections.singletonList(
				new RecordField("amount", TypeSymbol.wildcard()))));
		registry.addRecord(new TypeRecord("Close", Collections.emptyList()));
		PythonIf chain = ifStmt(compare(name("action"), PythonComparisonOperator.IN,
				tuple(name("Pay"), attr("Action", "Close"))), body(ret(bool(true))), body(ret(bool(false))));
		AikenWhen when = reconstruct(new TopLevelIssueContext(), registry, chain);
		assertThat(when.getArms().get(0).getPatterns(), is(Arrays.asList("Pay { .. }", "Close")));
		assertThat(when.getArms().get(1).isWildcard(), is(true));
	}

	@Test
	public void literalVariants() {
		PythonIf chain = ifStmt(compare(name("n"), PythonComparisonOperator.IN, list(num(1), num(2))),
				body(ret(str("small"))), body(
						ifStmt(compare(name("n"), PythonComparisonOperator.IN, tuple(num(3))), ret())));
		AikenWhen when = reconstruct(new TopLevelIssueContext(), new TypeRegistry(), chain);
		assertThat(when.getArms().get(0).getPatterns(), is(Arrays.asList("1", "2")));
		assertThat(when.getArms().get(1).getResult(), is("()"));
	}

	@Test
	public void ordinaryConditionIsLeftAlone() {
		PythonIf chain = ifStmt(compare(name("x"), PythonComparisonOperator.GT, num(0)), body(ret(num(1))),
				body(ret(num(2))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, new TypeRegistry(), chain), is(nullValue()));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void membershipInVariableIsLeftAlone() {
		// if x in allowed: return 1
		// else: return 0
		PythonIf chain = ifStmt(compare(name("x"), PythonComparisonOperator.IN, name("allowed")),
				body(ret(num(1))), body(ret(num(0))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, new TypeRegistry(), chain), is(nullValue()));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void differentAnchorsWarn() {
		PythonIf chain = ifStmt(isinstance("x", name("A")), body(ret(num(1))), body(
				ifStmt(isinstance("y", name("B")), ret(num(2)))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, new TypeRegistry(), chain), is(nullValue()));
		assertThat(ctx.getWarnings().size(), is(1));
		AmbiguousPatternIssue issue = (AmbiguousPatternIssue) ctx.getWarnings().get(0);
		assertThat(issue.getReconstruction(), is(AmbiguousPatternIssue.Reconstruction.DISPATCH));
	}

	@Test
	public void branchWithMoreThanAReturnWarns() {
		PythonIf chain = ifStmt(isinstance("x", name("A")), body(assign("y", num(1)), ret(name("y"))),
				body(ret(num(2))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, new TypeRegistry(), chain), is(nullValue()));
		assertThat(((AmbiguousPatternIssue) ctx.getWarnings().get(0)).getReason(),
				is("a branch is not a single return"));
	}

	@Test
	public void unparseableVariantWarns() {
		PythonIf chain = ifStmt(isinstance("x", call("make")), body(ret(num(1))), body(ret(num(2))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, new TypeRegistry(), chain), is(nullValue()));
		assertThat(ctx.getWarnings().size(), is(1));
	}

}
