package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.AikenExpression;
import pyken.model.aiken.AikenPipeline;
import pyken.model.python.PythonStatement;
import pyken.scope.NameScope;

public class PipelineReconstructorTest {

	private static PipelineReconstructor.Pipeline reconstruct(TopLevelIssueContext ctx, List<PythonStatement> body) {
		return PipelineReconstructor.reconstruct(ctx, new NameScope(), body);
	}

	@Test
	public void threadedFirstArgument() {
		// t = base(); t = step1(t, 1); t = step2(t, 2); return t
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PipelineReconstructor.Pipeline pipeline = reconstruct(ctx, body(
				assign("t", call("base")),
				assign("t", call("step1", name("t"), num(1))),
				assign("t", call("step2", name("t"), num(2))),
				ret(name("t"))));
		assertThat(pipeline.getStart(), is(0));
		assertThat(pipeline.getStatement(), is(new AikenPipeline("base()", Arrays.asList("step1(1)", "step2(2)"))));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void stageShapes() {
		PipelineReconstructor.Pipeline pipeline = reconstruct(new TopLevelIssueContext(), body(
				assign("v", name("start")),
				assign("v", call(attr("v", "pipe"), name("scale"), num(3))),
				assign("v", call(attr("v", "negate"))),
				assign("v", call(name("combine"), exprs(num(1)), kw("into", attr("v", "total")))),
				assign("v", call("finish", name("v"))),
				ret(name("v"))));
		AikenPipeline statement = (AikenPipeline) pipeline.getStatement();
		assertThat(statement.getBase(), is("start"));
		assertThat(statement.getStages(), is(Arrays.asList("scale(3)", "negate", "combine(1)", "finish")));
	}

	@Test
	public void prefixStatementsAreKept() {
		PipelineReconstructor.Pipeline pipeline = reconstruct(new TopLevelIssueContext(), body(
				assign("limit", num(10)),
				assign("t", call("base")),
				assign("t", call("clamp", name("t"), name("limit"))),
				ret(name("t"))));
		assertThat(pipeline.getStart(), is(1));
		assertThat(((AikenPipeline) pipeline.getStatement()).getStages(),
				is(Collections.singletonList("clamp(limit)")));
	}

	@Test
	public void singleAssignmentIsJustTheValue() {
		PipelineReconstructor.Pipeline pipeline = reconstruct(new TopLevelIssueContext(), body(
				assign("t", call("base")),
				ret(name("t"))));
		assertThat(pipeline.getStatement(), is(new AikenExpression("base()")));
	}

	@Test
	public void notEligible() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, body(ret(call("base")))), is(nullValue()));
		assertThat(reconstruct(ctx, body(assign("t", num(1)), ret(name("u")))), is(nullValue()));
		assertThat(reconstruct(ctx, Collections.emptyList()), is(nullValue()));
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void reassignmentWithoutThreadingWarns() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(reconstruct(ctx, body(
				assign("t", call("base")),
				assign("t", call("other", num(1))),
				ret(name("t")))), is(nullValue()));
		assertThat(ctx.getWarnings().size(), is(1));
		assertThat(((AmbiguousPatternIssue) ctx.getWarnings().get(0)).getReconstruction(),
				is(AmbiguousPatternIssue.Reconstruction.PIPELINE));
	}

	@Test
	public void warningsFromAFailedAttemptAreDropped() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		reconstruct(ctx, body(
				assign("t", unsupportedExpr("Lambda")),
				assign("t", num(2)),
				ret(name("t"))));
		assertThat(ctx.getWarnings().size(), is(1));
		assertThat(ctx.getWarnings().get(0), is(instanceOf(AmbiguousPatternIssue.class)));
	}

}
