package pyken.trans.passes.codegen.aiken;

import pyken.errors.IssueContext;
import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.*;
import pyken.model.python.*;
import pyken.model.type.TypeRecord;
import pyken.model.type.TypeRegistry;
import pyken.scope.NameScope;
import pyken.util.Identifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Renders one Python statement as zero or more Aiken statements.
 */
public class PythonStatementCodeGenVisitor extends PythonStatementVisitor<List<AikenStatement>, RuntimeException> {

	private final IssueContext ctx;
	private final TypeRegistry registry;
	private final NameScope scope;
	private final boolean inTest;

	public PythonStatementCodeGenVisitor(IssueContext ctx, TypeRegistry registry, NameScope scope, boolean inTest) {
		this.ctx = ctx;
		this.registry = registry;
		this.scope = scope;
		this.inTest = inTest;
	}

	public List<AikenStatement> renderBody(List<PythonStatement> body) {
		List<AikenStatement> result = new ArrayList<>();
		for (PythonStatement statement : body) {
			result.addAll(statement.accept(this));
		}
		return result;
	}

	private String render(PythonExpression expression) {
		return expression.accept(new PythonExpressionCodeGenVisitor(ctx, scope));
	}

	private List<AikenStatement> single(AikenStatement statement) {
		return Collections.singletonList(statement);
	}

	private List<AikenStatement> unsupported(String kind, PythonNode node) {
		ctx.warn(new UnsupportedConstructIssue(kind, node.getLocation()));
		return single(new AikenExpression(PythonExpressionCodeGenVisitor.PLACEHOLDER));
	}

	@Override
	public List<AikenStatement> visit(PythonImport pythonImport) throws RuntimeException {
		return unsupported("nested import", pythonImport);
	}

	@Override
	public List<AikenStatement> visit(PythonImportFrom pythonImportFrom) throws RuntimeException {
		return unsupported("nested import", pythonImportFrom);
	}

	@Override
	public List<AikenStatement> visit(PythonClassDef pythonClassDef) throws RuntimeException {
		return unsupported("nested class " + pythonClassDef.getName(), pythonClassDef);
	}

	@Override
	public List<AikenStatement> visit(PythonFunctionDef pythonFunctionDef) throws RuntimeException {
		return unsupported("nested function " + pythonFunctionDef.getName(), pythonFunctionDef);
	}

	@Override
	public List<AikenStatement> visit(PythonAssign pythonAssign) throws RuntimeException {
		if (pythonAssign.getTargets().size() != 1) {
			return unsupported("chained assignment", pythonAssign);
		}
		PythonExpression target = pythonAssign.getTargets().get(0);
		PythonExpression value = pythonAssign.getValue();
		if (target instanceof PythonName) {
			String name = ((PythonName) target).getId();
			if (inTest) {
				Optional<String> collection = elementCollection(value);
				if (collection.isPresent()) {
					String element = ElementNames.normalize(name);
					if (!element.equals(name)) {
						scope.bind(name, element);
					}
					return single(new AikenExpect("[" + element + "]", collection.get()));
				}
			}
			if (value instanceof PythonCall && Identifiers.isCapitalized(name)) {
				String constructor = ((PythonCall) value).getCalleeName();
				if (Identifiers.isCapitalized(constructor)) {
					Optional<TypeRecord> record = registry.findRecord(constructor);
					List<String> fields = null;
					if (record.isPresent() && !record.get().getFields().isEmpty()) {
						fields = record.get().getFieldNames();
					}
					return single(new AikenRecordDestructure(constructor, fields, name));
				}
			}
			return single(new AikenLet(name, render(value)));
		}
		if (target instanceof PythonTuple || target instanceof PythonList) {
			List<PythonExpression> elements = target instanceof PythonTuple ?
					((PythonTuple) target).getElements() : ((PythonList) target).getElements();
			List<String> names = new ArrayList<>();
			for (PythonExpression element : elements) {
				if (!(element instanceof PythonName)) {
					return unsupported("assignment target", pythonAssign);
				}
				names.add(((PythonName) element).getId());
			}
			return single(new AikenLet("(" + String.join(", ", names) + ")", render(value)));
		}
		return unsupported("assignment target", pythonAssign);
	}

	/**
	 * Matches {@code tx.inputs[...]} and {@code tx.outputs[...]}.
	 *
	 * @return the rendered collection, if value picks one element out of one
	 */
	private Optional<String> elementCollection(PythonExpression value) {
		if (!(value instanceof PythonSubscript)) {
			return Optional.empty();
		}
		PythonExpression base = ((PythonSubscript) value).getValue();
		if (base instanceof PythonAttribute) {
			String attribute = ((PythonAttribute) base).getAttribute();
			if (attribute.equals("inputs") || attribute.equals("outputs")) {
				return Optional.of(render(base));
			}
		}
		// only the text matters here, so warnings go to a scratch context
		String rendered = base.accept(new PythonExpressionCodeGenVisitor(new TopLevelIssueContext(), scope));
		if (rendered.endsWith(".inputs") || rendered.endsWith(".outputs")) {
			return Optional.of(render(base));
		}
		return Optional.empty();
	}

	@Override
	public List<AikenStatement> visit(PythonAnnAssign pythonAnnAssign) throws RuntimeException {
		if (!(pythonAnnAssign.getTarget() instanceof PythonName)) {
			return unsupported("assignment target", pythonAnnAssign);
		}
		if (pythonAnnAssign.getValue() == null) {
			// declaration only
			return Collections.emptyList();
		}
		return single(new AikenLet(((PythonName) pythonAnnAssign.getTarget()).getId(),
				render(pythonAnnAssign.getValue())));
	}

	@Override
	public List<AikenStatement> visit(PythonAugAssign pythonAugAssign) throws RuntimeException {
		if (!(pythonAugAssign.getTarget() instanceof PythonName)) {
			return unsupported("assignment target", pythonAugAssign);
		}
		PythonBinOp combined = new PythonBinOp(pythonAugAssign.getLocation(), pythonAugAssign.getTarget(),
				pythonAugAssign.getOperator(), pythonAugAssign.getValue());
		return single(new AikenLet(((PythonName) pythonAugAssign.getTarget()).getId(), render(combined)));
	}

	@Override
	public List<AikenStatement> visit(PythonIf pythonIf) throws RuntimeException {
		if (pythonIf.getOrElse().isEmpty() && isNoneCheck(pythonIf.getTest())) {
			String name = render(((PythonCompare) pythonIf.getTest()).getLeft());
			return single(new AikenExpect("Some(" + name + ")", name));
		}
		AikenWhen when = DispatchChainReconstructor.reconstruct(ctx, registry, scope, pythonIf);
		if (when != null) {
			return single(when);
		}
		return single(new AikenIf(
				render(pythonIf.getTest()),
				renderBody(pythonIf.getBody()),
				renderBody(pythonIf.getOrElse())));
	}

	private static boolean isNoneCheck(PythonExpression test) {
		if (!(test instanceof PythonCompare)) {
			return false;
		}
		PythonCompare compare = (PythonCompare) test;
		return compare.getLeft() instanceof PythonName &&
				compare.getOperators().get(0) == PythonComparisonOperator.IS &&
				compare.getComparators().get(0) instanceof PythonNoneLiteral;
	}

	@Override
	public List<AikenStatement> visit(PythonReturn pythonReturn) throws RuntimeException {
		if (pythonReturn.getValue() == null) {
			return single(new AikenExpression("()"));
		}
		return single(new AikenExpression(render(pythonReturn.getValue())));
	}

	@Override
	public List<AikenStatement> visit(PythonAssert pythonAssert) throws RuntimeException {
		return single(new AikenExpect(null, render(pythonAssert.getTest())));
	}

	@Override
	public List<AikenStatement> visit(PythonRaise pythonRaise) throws RuntimeException {
		return single(new AikenFail());
	}

	@Override
	public List<AikenStatement> visit(PythonTry pythonTry) throws RuntimeException {
		List<PythonStatement> body = pythonTry.getBody();
		if (body.size() == 1 && body.get(0) instanceof PythonExpressionStatement) {
			PythonExpression value = ((PythonExpressionStatement) body.get(0)).getValue();
			if (value instanceof PythonCall) {
				return single(new AikenExpression("!" + value.accept(new PythonExpressionCodeGenVisitor(
						ctx, scope, PythonExpressionCodeGenVisitor.PRECEDENCE_UNARY))));
			}
		}
		return single(new AikenExpect(null, "False"));
	}

	@Override
	public List<AikenStatement> visit(PythonExpressionStatement pythonExpressionStatement) throws RuntimeException {
		if (pythonExpressionStatement.isDocstring()) {
			return Collections.emptyList();
		}
		return single(new AikenExpression(render(pythonExpressionStatement.getValue())));
	}

	@Override
	public List<AikenStatement> visit(PythonPass pythonPass) throws RuntimeException {
		return Collections.emptyList();
	}

	@Override
	public List<AikenStatement> visit(PythonUnsupportedStatement pythonUnsupportedStatement) throws RuntimeException {
		return unsupported(pythonUnsupportedStatement.getKind(), pythonUnsupportedStatement);
	}
}
