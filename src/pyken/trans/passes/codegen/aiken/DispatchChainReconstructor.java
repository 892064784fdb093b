package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenWhen;
import pyken.model.aiken.AikenWhenArm;
import pyken.model.python.*;
import pyken.model.type.TypeRegistry;
import pyken.scope.NameScope;
import pyken.util.Identifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites an if/elif/else chain that tests the shape of one variable into a when expression.
 *
 * Each test must be {@code isinstance(x, T)}, {@code isinstance(x, (T, U))} or {@code x in (A, B)} on
 * the same variable x, and each branch, including a final else if present, must be exactly one
 * return. A chain without a final else produces no wildcard arm.
 */
public class DispatchChainReconstructor {

	private DispatchChainReconstructor() {}

	private static class Branch {
		final PythonExpression test;
		final List<PythonStatement> body;

		Branch(PythonExpression test, List<PythonStatement> body) {
			this.test = test;
			this.body = body;
		}
	}

	/**
	 * @return the reconstructed when expression, or null if the chain should be emitted as plain ifs
	 */
	public static AikenWhen reconstruct(IssueContext ctx, TypeRegistry registry, NameScope scope, PythonIf head) {
		List<Branch> chain = new ArrayList<>();
		PythonIf current = head;
		List<PythonStatement> finalElse;
		while (true) {
			chain.add(new Branch(current.getTest(), current.getBody()));
			List<PythonStatement> orElse = current.getOrElse();
			if (orElse.size() == 1 && orElse.get(0) instanceof PythonIf) {
				current = (PythonIf) orElse.get(0);
			} else {
				finalElse = orElse;
				break;
			}
		}

		PythonExpression anchor = null;
		String anchorName = null;
		for (Branch branch : chain) {
			PythonExpression branchAnchor = anchorOf(branch.test);
			if (branchAnchor == null) {
				// ordinary conditional
				return null;
			}
			String branchAnchorName = ((PythonName) branchAnchor).getId();
			if (anchorName == null) {
				anchor = branchAnchor;
				anchorName = branchAnchorName;
			} else if (!anchorName.equals(branchAnchorName)) {
				return ambiguous(ctx, "branches test different variables", head);
			}
		}
		for (Branch branch : chain) {
			if (!isSingleReturn(branch.body)) {
				return ambiguous(ctx, "a branch is not a single return", head);
			}
		}
		if (!finalElse.isEmpty() && !isSingleReturn(finalElse)) {
			return ambiguous(ctx, "the final else is not a single return", head);
		}

		PythonExpressionCodeGenVisitor render = new PythonExpressionCodeGenVisitor(ctx, scope);
		List<AikenWhenArm> arms = new ArrayList<>();
		for (Branch branch : chain) {
			List<String> patterns = variantsOf(ctx, registry, scope, branch.test);
			if (patterns == null) {
				return ambiguous(ctx, "a variant is neither a name nor a literal", head);
			}
			arms.add(new AikenWhenArm(patterns, returnValue(render, branch.body)));
		}
		if (!finalElse.isEmpty()) {
			arms.add(new AikenWhenArm(Collections.singletonList(AikenWhenArm.WILDCARD), returnValue(render, finalElse)));
		}
		return new AikenWhen(anchor.accept(render), arms);
	}

	private static AikenWhen ambiguous(IssueContext ctx, String reason, PythonIf head) {
		ctx.warn(new AmbiguousPatternIssue(AmbiguousPatternIssue.Reconstruction.DISPATCH, reason, head.getLocation()));
		return null;
	}

	private static boolean isSingleReturn(List<PythonStatement> body) {
		return body.size() == 1 && body.get(0) instanceof PythonReturn;
	}

	private static String returnValue(PythonExpressionCodeGenVisitor render, List<PythonStatement> body) {
		PythonExpression value = ((PythonReturn) body.get(0)).getValue();
		if (value == null) {
			return "()";
		}
		return value.accept(render);
	}

	/**
	 * @return the variable a shape test inspects, or null if the test is not a shape test
	 */
	static PythonExpression anchorOf(PythonExpression test) {
		if (test instanceof PythonCall) {
			PythonCall call = (PythonCall) test;
			if (call.getFunction() instanceof PythonName &&
					((PythonName) call.getFunction()).getId().equals("isinstance") &&
					call.getArguments().size() == 2 &&
					call.getArguments().get(0) instanceof PythonName) {
				return call.getArguments().get(0);
			}
		}
		if (test instanceof PythonCompare) {
			PythonCompare compare = (PythonCompare) test;
			if (compare.getLeft() instanceof PythonName &&
					compare.getOperators().size() == 1 &&
					compare.getOperators().get(0) == PythonComparisonOperator.IN) {
				// membership in a variable is a runtime lookup, not a set of variants
				PythonExpression variants = compare.getComparators().get(0);
				if (variants instanceof PythonTuple || variants instanceof PythonList) {
					return compare.getLeft();
				}
			}
		}
		return null;
	}

	private static List<String> variantsOf(IssueContext ctx, TypeRegistry registry, NameScope scope,
	                                       PythonExpression test) {
		PythonExpression variants;
		if (test instanceof PythonCall) {
			variants = ((PythonCall) test).getArguments().get(1);
		} else {
			variants = ((PythonCompare) test).getComparators().get(0);
		}
		List<PythonExpression> alternatives;
		if (variants instanceof PythonTuple) {
			alternatives = ((PythonTuple) variants).getElements();
		} else if (variants instanceof PythonList) {
			alternatives = ((PythonList) variants).getElements();
		} else {
			alternatives = Collections.singletonList(variants);
		}
		if (alternatives.isEmpty()) {
			return null;
		}
		List<String> patterns = new ArrayList<>();
		for (PythonExpression alternative : alternatives) {
			String pattern = variantOf(ctx, registry, scope, alternative);
			if (pattern == null) {
				return null;
			}
			patterns.add(pattern);
		}
		return patterns;
	}

	private static String variantOf(IssueContext ctx, TypeRegistry registry, NameScope scope,
	                                PythonExpression alternative) {
		if (alternative instanceof PythonName) {
			String name = ((PythonName) alternative).getId();
			if (registry.hasFields(name)) {
				return name + " { .. }";
			}
			return name;
		}
		if (alternative instanceof PythonAttribute) {
			String attribute = ((PythonAttribute) alternative).getAttribute();
			if (Identifiers.isCapitalized(attribute)) {
				return registry.hasFields(attribute) ? attribute + " { .. }" : attribute;
			}
			return alternative.accept(new PythonExpressionCodeGenVisitor(ctx, scope));
		}
		if (alternative instanceof PythonStringLiteral || alternative instanceof PythonIntegerLiteral ||
				alternative instanceof PythonBooleanLiteral || alternative instanceof PythonBytesLiteral ||
				alternative instanceof PythonNoneLiteral) {
			return alternative.accept(new PythonExpressionCodeGenVisitor(ctx, scope));
		}
		return null;
	}
}
