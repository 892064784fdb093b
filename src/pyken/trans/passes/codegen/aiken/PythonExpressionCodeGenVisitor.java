package pyken.trans.passes.codegen.aiken;

import pyken.Unreachable;
import pyken.errors.IssueContext;
import pyken.model.python.*;
import pyken.scope.NameScope;
import pyken.util.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders one Python expression as Aiken expression text. Rendering never fails: shapes with no
 * translation rule become {@link #PLACEHOLDER} and raise an {@link UnsupportedConstructIssue} warning.
 *
 * The precedence passed in is that of the surrounding context; the rendered expression is
 * parenthesized if it binds less tightly than its context.
 */
public class PythonExpressionCodeGenVisitor extends PythonExpressionVisitor<String, RuntimeException> {

	public static final String PLACEHOLDER = "todo";

	static final int PRECEDENCE_PIPE = 0;
	static final int PRECEDENCE_OR = 1;
	static final int PRECEDENCE_AND = 2;
	static final int PRECEDENCE_COMPARISON = 3;
	static final int PRECEDENCE_ADDITIVE = 4;
	static final int PRECEDENCE_MULTIPLICATIVE = 5;
	static final int PRECEDENCE_UNARY = 6;
	static final int PRECEDENCE_ATOM = 7;

	private final IssueContext ctx;
	private final NameScope scope;
	private final int precedence;

	public PythonExpressionCodeGenVisitor(IssueContext ctx, NameScope scope, int precedence) {
		this.ctx = ctx;
		this.scope = scope;
		this.precedence = precedence;
	}

	public PythonExpressionCodeGenVisitor(IssueContext ctx, NameScope scope) {
		this(ctx, scope, PRECEDENCE_PIPE);
	}

	private String render(PythonExpression expression, int contextPrecedence) {
		return expression.accept(new PythonExpressionCodeGenVisitor(ctx, scope, contextPrecedence));
	}

	private String render(PythonExpression expression) {
		return render(expression, PRECEDENCE_PIPE);
	}

	private String wrap(String text, int operatorPrecedence) {
		if (operatorPrecedence < precedence) {
			return "(" + text + ")";
		}
		return text;
	}

	private String unsupported(String kind, PythonNode node) {
		ctx.warn(new UnsupportedConstructIssue(kind, node.getLocation()));
		return PLACEHOLDER;
	}

	private String renderArguments(List<PythonExpression> arguments) {
		return arguments.stream().map(this::render).collect(Collectors.joining(", "));
	}

	@Override
	public String visit(PythonBooleanLiteral pythonBooleanLiteral) throws RuntimeException {
		return pythonBooleanLiteral.getValue() ? "True" : "False";
	}

	@Override
	public String visit(PythonIntegerLiteral pythonIntegerLiteral) throws RuntimeException {
		return wrap(pythonIntegerLiteral.getValue().toString(),
				pythonIntegerLiteral.getValue().signum() < 0 ? PRECEDENCE_UNARY : PRECEDENCE_ATOM);
	}

	@Override
	public String visit(PythonFloatLiteral pythonFloatLiteral) throws RuntimeException {
		return pythonFloatLiteral.getText();
	}

	@Override
	public String visit(PythonStringLiteral pythonStringLiteral) throws RuntimeException {
		return AikenStrings.quote(pythonStringLiteral.getValue());
	}

	@Override
	public String visit(PythonBytesLiteral pythonBytesLiteral) throws RuntimeException {
		return AikenStrings.quoteBytes(pythonBytesLiteral.getValue());
	}

	@Override
	public String visit(PythonNoneLiteral pythonNoneLiteral) throws RuntimeException {
		return "None";
	}

	@Override
	public String visit(PythonName pythonName) throws RuntimeException {
		return scope.resolve(ReservedNames.normalize(pythonName.getId()));
	}

	@Override
	public String visit(PythonAttribute pythonAttribute) throws RuntimeException {
		String attribute = pythonAttribute.getAttribute();
		if (attribute.equals("else_")) {
			return render(pythonAttribute.getValue(), PRECEDENCE_ATOM) + ".else";
		}
		if (ReservedNames.isReserved(attribute)) {
			return ReservedNames.normalize(attribute);
		}
		// enum-style access: Redeemer.Success
		if (Identifiers.isCapitalized(attribute)) {
			return attribute;
		}
		PythonExpression value = pythonAttribute.getValue();
		if (value instanceof PythonName && ((PythonName) value).getId().equals("self")) {
			return attribute;
		}
		return render(value, PRECEDENCE_ATOM) + "." + attribute;
	}

	@Override
	public String visit(PythonCall pythonCall) throws RuntimeException {
		PythonExpression function = pythonCall.getFunction();
		List<PythonExpression> arguments = pythonCall.getArguments();
		String calleeName = pythonCall.getCalleeName();

		if (function instanceof PythonName) {
			String reserved = ReservedNames.normalizeCallee(calleeName);
			if (reserved != null) {
				return reserved;
			}
			switch (calleeName) {
				case "Some":
					return "Some(" + renderArguments(arguments) + ")";
				case "None":
					return "None";
				case "placeholder":
					return "placeholder";
				case "any":
				case "all":
					if (arguments.size() == 1 && arguments.get(0) instanceof PythonComprehension) {
						return renderListFunction("list." + calleeName, (PythonComprehension) arguments.get(0));
					}
					break;
				case "print":
					if (arguments.size() == 1 && arguments.get(0) instanceof PythonStringLiteral) {
						return wrap("trace @" + render(arguments.get(0)), PRECEDENCE_UNARY);
					}
					break;
			}
		}

		if (function instanceof PythonAttribute && calleeName.equals("pipe") && !arguments.isEmpty()) {
			String base = render(((PythonAttribute) function).getValue(), PRECEDENCE_PIPE + 1);
			String stage = render(arguments.get(0), PRECEDENCE_ATOM);
			List<PythonExpression> rest = arguments.subList(1, arguments.size());
			if (!rest.isEmpty()) {
				stage = stage + "(" + renderArguments(rest) + ")";
			}
			return wrap(base + " |> " + stage, PRECEDENCE_PIPE);
		}

		if (Identifiers.isCapitalized(calleeName)) {
			if (!pythonCall.getKeywords().isEmpty()) {
				List<String> fields = new ArrayList<>();
				for (PythonKeyword keyword : pythonCall.getKeywords()) {
					if (keyword.getName() == null) {
						fields.add(unsupported("keyword unpacking", keyword));
					} else {
						fields.add(keyword.getName() + ": " + render(keyword.getValue()));
					}
				}
				return calleeName + " { " + String.join(", ", fields) + " }";
			}
			if (!arguments.isEmpty()) {
				return calleeName + "(" + renderArguments(arguments) + ")";
			}
			return calleeName;
		}

		List<String> renderedArguments = new ArrayList<>();
		for (PythonExpression argument : arguments) {
			renderedArguments.add(render(argument));
		}
		for (PythonKeyword keyword : pythonCall.getKeywords()) {
			if (keyword.getName() == null) {
				renderedArguments.add(unsupported("keyword unpacking", keyword));
			} else {
				renderedArguments.add(keyword.getName() + ": " + render(keyword.getValue()));
			}
		}
		return render(function, PRECEDENCE_ATOM) + "(" + String.join(", ", renderedArguments) + ")";
	}

	@Override
	public String visit(PythonBinOp pythonBinOp) throws RuntimeException {
		String operator;
		int operatorPrecedence;
		switch (pythonBinOp.getOperator()) {
			case ADD:
				operator = "+";
				operatorPrecedence = PRECEDENCE_ADDITIVE;
				break;
			case SUB:
				operator = "-";
				operatorPrecedence = PRECEDENCE_ADDITIVE;
				break;
			case MULT:
				operator = "*";
				operatorPrecedence = PRECEDENCE_MULTIPLICATIVE;
				break;
			case DIV:
			case FLOOR_DIV:
				operator = "/";
				operatorPrecedence = PRECEDENCE_MULTIPLICATIVE;
				break;
			case MOD:
				operator = "%";
				operatorPrecedence = PRECEDENCE_MULTIPLICATIVE;
				break;
			default:
				return unsupported("operator " + pythonBinOp.getOperator().getNodeName(), pythonBinOp);
		}
		return wrap(render(pythonBinOp.getLeft(), operatorPrecedence) + " " + operator + " " +
				render(pythonBinOp.getRight(), operatorPrecedence + 1), operatorPrecedence);
	}

	@Override
	public String visit(PythonBoolOp pythonBoolOp) throws RuntimeException {
		String operator;
		int operatorPrecedence;
		switch (pythonBoolOp.getOperator()) {
			case AND:
				operator = " && ";
				operatorPrecedence = PRECEDENCE_AND;
				break;
			case OR:
				operator = " || ";
				operatorPrecedence = PRECEDENCE_OR;
				break;
			default:
				throw new Unreachable();
		}
		List<String> operands = new ArrayList<>();
		for (PythonExpression value : pythonBoolOp.getValues()) {
			operands.add(render(value, operatorPrecedence + 1));
		}
		return wrap(String.join(operator, operands), operatorPrecedence);
	}

	@Override
	public String visit(PythonUnaryOp pythonUnaryOp) throws RuntimeException {
		switch (pythonUnaryOp.getOperator()) {
			case NOT:
				return wrap("!" + render(pythonUnaryOp.getOperand(), PRECEDENCE_UNARY), PRECEDENCE_UNARY);
			case U_SUB:
				return wrap("-" + render(pythonUnaryOp.getOperand(), PRECEDENCE_UNARY), PRECEDENCE_UNARY);
			case U_ADD:
				return pythonUnaryOp.getOperand().accept(this);
			default:
				return unsupported("operator " + pythonUnaryOp.getOperator().getNodeName(), pythonUnaryOp);
		}
	}

	@Override
	public String visit(PythonCompare pythonCompare) throws RuntimeException {
		List<PythonComparisonOperator> operators = pythonCompare.getOperators();
		List<PythonExpression> comparators = pythonCompare.getComparators();
		if (operators.size() == 1) {
			return comparison(pythonCompare, pythonCompare.getLeft(), operators.get(0), comparators.get(0), precedence);
		}
		// a < b < c becomes a < b && b < c
		List<String> links = new ArrayList<>();
		PythonExpression left = pythonCompare.getLeft();
		for (int i = 0; i < operators.size(); i++) {
			links.add(comparison(pythonCompare, left, operators.get(i), comparators.get(i), PRECEDENCE_AND + 1));
			left = comparators.get(i);
		}
		return wrap(String.join(" && ", links), PRECEDENCE_AND);
	}

	private String comparison(PythonCompare node, PythonExpression left, PythonComparisonOperator operator,
	                          PythonExpression right, int contextPrecedence) {
		String operatorText;
		switch (operator) {
			case EQ:
			case IS:
				operatorText = "==";
				break;
			case NOT_EQ:
			case IS_NOT:
				operatorText = "!=";
				break;
			case LT:
				operatorText = "<";
				break;
			case LT_E:
				operatorText = "<=";
				break;
			case GT:
				operatorText = ">";
				break;
			case GT_E:
				operatorText = ">=";
				break;
			case IN:
				return "list.has(" + render(right) + ", " + render(left) + ")";
			case NOT_IN:
				return parenthesize("!list.has(" + render(right) + ", " + render(left) + ")",
						PRECEDENCE_UNARY, contextPrecedence);
			default:
				return unsupported("operator " + operator.getNodeName(), node);
		}
		return parenthesize(render(left, PRECEDENCE_COMPARISON + 1) + " " + operatorText + " " +
				render(right, PRECEDENCE_COMPARISON + 1), PRECEDENCE_COMPARISON, contextPrecedence);
	}

	private static String parenthesize(String text, int operatorPrecedence, int contextPrecedence) {
		if (operatorPrecedence < contextPrecedence) {
			return "(" + text + ")";
		}
		return text;
	}

	@Override
	public String visit(PythonList pythonList) throws RuntimeException {
		return "[" + renderArguments(pythonList.getElements()) + "]";
	}

	@Override
	public String visit(PythonTuple pythonTuple) throws RuntimeException {
		return "(" + renderArguments(pythonTuple.getElements()) + ")";
	}

	@Override
	public String visit(PythonDict pythonDict) throws RuntimeException {
		if (pythonDict.getKeys().isEmpty()) {
			return "{}";
		}
		List<String> entries = new ArrayList<>();
		for (int i = 0; i < pythonDict.getKeys().size(); i++) {
			PythonExpression key = pythonDict.getKeys().get(i);
			if (key == null) {
				entries.add(unsupported("dict unpacking", pythonDict));
			} else {
				entries.add(render(key) + ": " + render(pythonDict.getValues().get(i)));
			}
		}
		return "{ " + String.join(", ", entries) + " }";
	}

	@Override
	public String visit(PythonSubscript pythonSubscript) throws RuntimeException {
		return render(pythonSubscript.getValue(), PRECEDENCE_ATOM) + "[" + render(pythonSubscript.getIndex()) + "]";
	}

	@Override
	public String visit(PythonComprehension pythonComprehension) throws RuntimeException {
		return renderListFunction("list.map", pythonComprehension);
	}

	private String renderListFunction(String function, PythonComprehension comprehension) {
		if (comprehension.getGenerators().size() != 1) {
			return unsupported("nested comprehension", comprehension);
		}
		PythonGenerator generator = comprehension.getGenerators().get(0);
		String parameter = render(generator.getTarget());
		String iterable = render(generator.getIterable());
		if (!generator.getConditions().isEmpty()) {
			List<String> conditions = new ArrayList<>();
			for (PythonExpression condition : generator.getConditions()) {
				conditions.add(render(condition, PRECEDENCE_AND + 1));
			}
			iterable = "list.filter(" + iterable + ", fn(" + parameter + ") { " +
					String.join(" && ", conditions) + " })";
		}
		return function + "(" + iterable + ", fn(" + parameter + ") { " + render(comprehension.getElement()) + " })";
	}

	@Override
	public String visit(PythonUnsupportedExpression pythonUnsupportedExpression) throws RuntimeException {
		return unsupported(pythonUnsupportedExpression.getKind(), pythonUnsupportedExpression);
	}
}
