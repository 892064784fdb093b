package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenFunction;
import pyken.model.aiken.AikenParameter;
import pyken.model.aiken.AikenStatement;
import pyken.model.declaration.FunctionDeclaration;
import pyken.model.python.PythonArgument;
import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeRegistry;
import pyken.model.type.TypeSymbol;
import pyken.scope.NameScope;
import pyken.trans.passes.type.PythonTypeTable;
import pyken.trans.passes.type.ReturnTypeInferenceVisitor;
import pyken.trans.passes.type.TypeUnresolvedIssue;

import java.util.ArrayList;
import java.util.List;

public class FunctionEmitter {

	private FunctionEmitter() {}

	public static AikenFunction emit(IssueContext ctx, TypeRegistry registry, FunctionDeclaration function) {
		List<AikenParameter> parameters = new ArrayList<>();
		for (PythonArgument argument : function.getArguments()) {
			parameters.add(new AikenParameter(argument.getName(),
					ParameterTypes.resolve(ctx, argument, function.getBody()).getName()));
		}

		String returnType = null;
		if (function.getReturns() != null) {
			returnType = PythonTypeTable.annotationType(function.getReturns());
		} else {
			TypeSymbol inferred = ReturnTypeInferenceVisitor.inferReturnType(function.getBody());
			if (inferred != null) {
				if (inferred.getProvenance() == TypeProvenance.FALLBACK) {
					ctx.warn(new TypeUnresolvedIssue("the return value of " + function.getName(),
							function.getLocation()));
				}
				returnType = inferred.getName();
			}
		}

		NameScope scope = new NameScope();
		PythonStatementCodeGenVisitor statements = new PythonStatementCodeGenVisitor(ctx, registry, scope, false);
		List<AikenStatement> body = new ArrayList<>();
		PipelineReconstructor.Pipeline pipeline = PipelineReconstructor.reconstruct(ctx, scope, function.getBody());
		if (pipeline != null) {
			body.addAll(statements.renderBody(function.getBody().subList(0, pipeline.getStart())));
			body.add(pipeline.getStatement());
		} else {
			body.addAll(statements.renderBody(function.getBody()));
		}
		return new AikenFunction(function.getName(), parameters, returnType, body);
	}
}
