package pyken.trans.passes.codegen.aiken;

import pyken.errors.Issue;
import pyken.errors.IssueContext;
import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.AikenExpression;
import pyken.model.aiken.AikenPipeline;
import pyken.model.aiken.AikenStatement;
import pyken.model.python.*;
import pyken.scope.NameScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a function body ending in
 *
 * <pre>
 *     v = base()
 *     v = step1(v, 1)
 *     v = step2(v, 2)
 *     return v
 * </pre>
 *
 * into {@code base() |> step1(1) |> step2(2)}.
 */
public class PipelineReconstructor {

	private PipelineReconstructor() {}

	public static class Pipeline {
		private final int start;
		private final AikenStatement statement;

		Pipeline(int start, AikenStatement statement) {
			this.start = start;
			this.statement = statement;
		}

		/**
		 * @return index of the first body statement replaced by the pipeline; every statement from there
		 * on, including the final return, is covered by {@link #getStatement()}
		 */
		public int getStart() {
			return start;
		}

		public AikenStatement getStatement() {
			return statement;
		}
	}

	/**
	 * @return the reconstructed pipeline, or null if the body does not end in reassignments of its
	 * returned variable or one of them cannot be written as a stage
	 */
	public static Pipeline reconstruct(IssueContext ctx, NameScope scope, List<PythonStatement> body) {
		if (body.isEmpty()) {
			return null;
		}
		PythonStatement last = body.get(body.size() - 1);
		if (!(last instanceof PythonReturn) || !(((PythonReturn) last).getValue() instanceof PythonName)) {
			return null;
		}
		String threaded = ((PythonName) ((PythonReturn) last).getValue()).getId();

		int start = body.size() - 1;
		while (start > 0) {
			PythonStatement previous = body.get(start - 1);
			if (previous instanceof PythonAssign && threaded.equals(((PythonAssign) previous).getSingleTargetName())) {
				start--;
			} else {
				break;
			}
		}
		List<PythonAssign> assigns = new ArrayList<>();
		for (int i = start; i < body.size() - 1; i++) {
			assigns.add((PythonAssign) body.get(i));
		}
		if (assigns.isEmpty()) {
			return null;
		}

		// warnings are only reported once the whole run is known to be a pipeline; otherwise the
		// statements are rendered again one by one and report their own
		TopLevelIssueContext attempt = new TopLevelIssueContext();
		PythonExpressionCodeGenVisitor render = new PythonExpressionCodeGenVisitor(attempt, scope);
		String base = assigns.get(0).getValue().accept(render);
		if (assigns.size() == 1) {
			replay(attempt, ctx);
			return new Pipeline(start, new AikenExpression(base));
		}
		List<String> stages = new ArrayList<>();
		for (PythonAssign assign : assigns.subList(1, assigns.size())) {
			String stage = stageOf(attempt, scope, assign.getValue(), threaded);
			if (stage == null) {
				ctx.warn(new AmbiguousPatternIssue(
						AmbiguousPatternIssue.Reconstruction.PIPELINE,
						"reassignment of " + threaded + " does not pass it to a call",
						assign.getLocation()));
				return null;
			}
			stages.add(stage);
		}
		replay(attempt, ctx);
		return new Pipeline(start, new AikenPipeline(base, stages));
	}

	private static void replay(TopLevelIssueContext attempt, IssueContext ctx) {
		for (Issue warning : attempt.getWarnings()) {
			ctx.warn(warning);
		}
	}

	private static String stageOf(IssueContext ctx, NameScope scope, PythonExpression value, String threaded) {
		if (!(value instanceof PythonCall)) {
			return null;
		}
		PythonCall call = (PythonCall) value;
		PythonExpression function = call.getFunction();
		List<PythonExpression> arguments = call.getArguments();
		List<PythonKeyword> keywords = call.getKeywords();

		// v.pipe(f, a)
		if (function instanceof PythonAttribute && isThreaded(((PythonAttribute) function).getValue(), threaded) &&
				((PythonAttribute) function).getAttribute().equals("pipe")) {
			if (arguments.isEmpty()) {
				return null;
			}
			return stage(ctx, scope, call, arguments.get(0), arguments.subList(1, arguments.size()), keywords);
		}
		// f(v, a)
		if (!arguments.isEmpty() && isThreaded(arguments.get(0), threaded)) {
			return stage(ctx, scope, call, function, arguments.subList(1, arguments.size()), keywords);
		}
		// v.m(a)
		if (function instanceof PythonAttribute && isThreaded(((PythonAttribute) function).getValue(), threaded)) {
			PythonName method = new PythonName(function.getLocation(), ((PythonAttribute) function).getAttribute());
			return stage(ctx, scope, call, method, arguments, keywords);
		}
		// f(a, x=v.attr)
		boolean found = false;
		List<PythonExpression> remainingArguments = new ArrayList<>();
		for (PythonExpression argument : arguments) {
			if (isThreadedOrAttribute(argument, threaded)) {
				found = true;
			} else {
				remainingArguments.add(argument);
			}
		}
		List<PythonKeyword> remainingKeywords = new ArrayList<>();
		for (PythonKeyword keyword : keywords) {
			if (isThreadedOrAttribute(keyword.getValue(), threaded)) {
				found = true;
			} else {
				remainingKeywords.add(keyword);
			}
		}
		if (found) {
			return stage(ctx, scope, call, function, remainingArguments, remainingKeywords);
		}
		return null;
	}

	private static String stage(IssueContext ctx, NameScope scope, PythonCall original, PythonExpression function,
	                            List<PythonExpression> arguments, List<PythonKeyword> keywords) {
		PythonExpression stage;
		if (arguments.isEmpty() && keywords.isEmpty()) {
			stage = function;
		} else {
			stage = new PythonCall(original.getLocation(), function, arguments, keywords);
		}
		return stage.accept(new PythonExpressionCodeGenVisitor(ctx, scope,
				PythonExpressionCodeGenVisitor.PRECEDENCE_PIPE + 1));
	}

	private static boolean isThreaded(PythonExpression expression, String threaded) {
		return expression instanceof PythonName && ((PythonName) expression).getId().equals(threaded);
	}

	private static boolean isThreadedOrAttribute(PythonExpression expression, String threaded) {
		return isThreaded(expression, threaded) ||
				(expression instanceof PythonAttribute && isThreaded(((PythonAttribute) expression).getValue(), threaded));
	}
}
