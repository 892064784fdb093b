package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.python.PythonArgument;
import pyken.model.python.PythonStatement;
import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;
import pyken.trans.passes.type.TypeResolver;
import pyken.trans.passes.type.TypeSignal;
import pyken.trans.passes.type.TypeUnresolvedIssue;

import java.util.List;

public class ParameterTypes {

	private ParameterTypes() {}

	/**
	 * Resolves the type of a parameter or field, warning if it fell back to the wildcard.
	 *
	 * @param scope statements searched for usage hints
	 */
	public static TypeSymbol resolve(IssueContext ctx, PythonArgument argument, List<PythonStatement> scope) {
		return warnIfUnresolved(ctx, argument, TypeResolver.resolve(
				new TypeSignal(argument.getName(), argument.getAnnotation(), argument.getDefaultValue(), scope)));
	}

	public static TypeSymbol resolveAnnotation(IssueContext ctx, PythonArgument argument) {
		return warnIfUnresolved(ctx, argument, TypeResolver.resolve(
				TypeSignal.annotationOnly(argument.getName(), argument.getAnnotation())));
	}

	private static TypeSymbol warnIfUnresolved(IssueContext ctx, PythonArgument argument, TypeSymbol type) {
		if (type.getProvenance() == TypeProvenance.FALLBACK) {
			ctx.warn(new TypeUnresolvedIssue(argument.getName(), argument.getLocation()));
		}
		return type;
	}
}
