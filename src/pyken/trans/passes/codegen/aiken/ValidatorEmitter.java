package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.model.aiken.AikenHandler;
import pyken.model.aiken.AikenParameter;
import pyken.model.aiken.AikenValidator;
import pyken.model.declaration.EntryPoint;
import pyken.model.declaration.ValidatorDeclaration;
import pyken.model.python.PythonArgument;
import pyken.model.type.TypeRegistry;
import pyken.scope.NameScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidatorEmitter {

	private ValidatorEmitter() {}

	private static final String DATUM_TYPE = "Option<Data>";
	private static final String REDEEMER_TYPE = "Data";

	public static AikenValidator emit(IssueContext ctx, TypeRegistry registry, ValidatorDeclaration validator) {
		List<AikenParameter> parameters = new ArrayList<>();
		for (PythonArgument argument : validator.getParameters()) {
			parameters.add(new AikenParameter(argument.getName(),
					ParameterTypes.resolveAnnotation(ctx, argument).getName()));
		}
		List<AikenHandler> handlers = new ArrayList<>();
		for (EntryPoint entryPoint : validator.getEntryPoints()) {
			handlers.add(emitHandler(ctx, registry, entryPoint));
		}
		return new AikenValidator(validator.getName(), parameters, handlers);
	}

	private static AikenHandler emitHandler(IssueContext ctx, TypeRegistry registry, EntryPoint entryPoint) {
		PythonStatementCodeGenVisitor body = new PythonStatementCodeGenVisitor(ctx, registry, new NameScope(), false);
		if (entryPoint.isCatchAll()) {
			return new AikenHandler("else", Collections.singletonList(new AikenParameter("_", null)),
					body.renderBody(entryPoint.getBody()));
		}
		List<AikenParameter> parameters = new ArrayList<>();
		for (PythonArgument argument : entryPoint.getParameters()) {
			String name = argument.getName();
			if (name.equals("_")) {
				parameters.add(new AikenParameter(name, null));
			} else if (ReservedNames.isDatumName(name)) {
				parameters.add(new AikenParameter(name, DATUM_TYPE));
			} else if (ReservedNames.isRedeemerName(name)) {
				parameters.add(new AikenParameter(name, REDEEMER_TYPE));
			} else {
				parameters.add(new AikenParameter(name, ParameterTypes.resolveAnnotation(ctx, argument).getName()));
			}
		}
		return new AikenHandler(entryPoint.getName(), parameters, body.renderBody(entryPoint.getBody()));
	}
}
