package pyken.model.python;

import pyken.util.SourceLocation;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class PythonBuilder {
	private PythonBuilder() {}

	public static PythonModule module(PythonStatement... body) {
		return new PythonModule(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static List<PythonStatement> body(PythonStatement... statements) {
		return Arrays.asList(statements);
	}

	// statements

	public static PythonImport importModule(PythonAlias... aliases) {
		return new PythonImport(SourceLocation.unknown(), Arrays.asList(aliases));
	}

	public static PythonImportFrom importFrom(String module, PythonAlias... aliases) {
		return new PythonImportFrom(SourceLocation.unknown(), module, Arrays.asList(aliases));
	}

	public static PythonAlias alias(String name) {
		return new PythonAlias(SourceLocation.unknown(), name, null);
	}

	public static PythonAlias alias(String name, String asName) {
		return new PythonAlias(SourceLocation.unknown(), name, asName);
	}

	public static PythonClassDef classDef(String name, List<PythonExpression> bases, PythonStatement... body) {
		return new PythonClassDef(SourceLocation.unknown(), name, bases, Collections.emptyList(),
				Arrays.asList(body));
	}

	public static PythonClassDef classDef(String name, PythonStatement... body) {
		return classDef(name, Collections.emptyList(), body);
	}

	public static PythonClassDef decoratedClassDef(String name, List<PythonExpression> decorators,
	                                               PythonStatement... body) {
		return new PythonClassDef(SourceLocation.unknown(), name, Collections.emptyList(), decorators,
				Arrays.asList(body));
	}

	public static List<PythonExpression> exprs(PythonExpression... expressions) {
		return Arrays.asList(expressions);
	}

	public static PythonFunctionDef def(String name, List<PythonArgument> arguments, PythonStatement... body) {
		return new PythonFunctionDef(SourceLocation.unknown(), name, arguments, null, Collections.emptyList(),
				Arrays.asList(body));
	}

	public static PythonFunctionDef def(String name, List<PythonArgument> arguments, PythonExpression returns,
	                                    PythonStatement... body) {
		return new PythonFunctionDef(SourceLocation.unknown(), name, arguments, returns, Collections.emptyList(),
				Arrays.asList(body));
	}

	public static List<PythonArgument> args(PythonArgument... arguments) {
		return Arrays.asList(arguments);
	}

	public static List<PythonArgument> args(String... names) {
		PythonArgument[] arguments = new PythonArgument[names.length];
		for (int i = 0; i < names.length; i++) {
			arguments[i] = arg(names[i]);
		}
		return Arrays.asList(arguments);
	}

	public static PythonArgument arg(String name) {
		return new PythonArgument(SourceLocation.unknown(), name, null, null);
	}

	public static PythonArgument arg(String name, PythonExpression annotation) {
		return new PythonArgument(SourceLocation.unknown(), name, annotation, null);
	}

	public static PythonArgument arg(String name, PythonExpression annotation, PythonExpression defaultValue) {
		return new PythonArgument(SourceLocation.unknown(), name, annotation, defaultValue);
	}

	public static PythonAssign assign(String target, PythonExpression value) {
		return assign(name(target), value);
	}

	public static PythonAssign assign(PythonExpression target, PythonExpression value) {
		return new PythonAssign(SourceLocation.unknown(), Collections.singletonList(target), value);
	}

	public static PythonAnnAssign annAssign(String target, PythonExpression annotation, PythonExpression value) {
		return new PythonAnnAssign(SourceLocation.unknown(), name(target), annotation, value);
	}

	public static PythonAugAssign augAssign(String target, PythonBinaryOperator operator, PythonExpression value) {
		return new PythonAugAssign(SourceLocation.unknown(), name(target), operator, value);
	}

	public static PythonIf ifStmt(PythonExpression test, List<PythonStatement> body, List<PythonStatement> orElse) {
		return new PythonIf(SourceLocation.unknown(), test, body, orElse);
	}

	public static PythonIf ifStmt(PythonExpression test, PythonStatement... body) {
		return ifStmt(test, Arrays.asList(body), Collections.emptyList());
	}

	public static PythonReturn ret(PythonExpression value) {
		return new PythonReturn(SourceLocation.unknown(), value);
	}

	public static PythonReturn ret() {
		return ret(null);
	}

	public static PythonAssert assertStmt(PythonExpression test) {
		return new PythonAssert(SourceLocation.unknown(), test, null);
	}

	public static PythonRaise raise(PythonExpression exception) {
		return new PythonRaise(SourceLocation.unknown(), exception);
	}

	public static PythonTry tryStmt(List<PythonStatement> body, PythonExceptHandler... handlers) {
		return new PythonTry(SourceLocation.unknown(), body, Arrays.asList(handlers), Collections.emptyList(),
				Collections.emptyList());
	}

	public static PythonExceptHandler except(PythonExpression type, PythonStatement... body) {
		return new PythonExceptHandler(SourceLocation.unknown(), type, null, Arrays.asList(body));
	}

	public static PythonExpressionStatement expr(PythonExpression value) {
		return new PythonExpressionStatement(SourceLocation.unknown(), value);
	}

	public static PythonPass pass() {
		return new PythonPass(SourceLocation.unknown());
	}

	public static PythonUnsupportedStatement unsupportedStmt(String kind) {
		return new PythonUnsupportedStatement(SourceLocation.unknown(), kind);
	}

	// expressions

	public static PythonName name(String id) {
		return new PythonName(SourceLocation.unknown(), id);
	}

	public static PythonBooleanLiteral bool(boolean value) {
		return new PythonBooleanLiteral(SourceLocation.unknown(), value);
	}

	public static PythonIntegerLiteral num(long value) {
		return new PythonIntegerLiteral(SourceLocation.unknown(), BigInteger.valueOf(value));
	}

	public static PythonIntegerLiteral num(BigInteger value) {
		return new PythonIntegerLiteral(SourceLocation.unknown(), value);
	}

	public static PythonFloatLiteral floatNum(String text) {
		return new PythonFloatLiteral(SourceLocation.unknown(), text);
	}

	public static PythonStringLiteral str(String value) {
		return new PythonStringLiteral(SourceLocation.unknown(), value);
	}

	public static PythonBytesLiteral bytes(byte[] value) {
		return new PythonBytesLiteral(SourceLocation.unknown(), value);
	}

	public static PythonBytesLiteral bytes(String utf8) {
		return bytes(utf8.getBytes(StandardCharsets.UTF_8));
	}

	public static PythonNoneLiteral none() {
		return new PythonNoneLiteral(SourceLocation.unknown());
	}

	public static PythonAttribute attr(PythonExpression value, String attribute) {
		return new PythonAttribute(SourceLocation.unknown(), value, attribute);
	}

	public static PythonAttribute attr(String value, String attribute) {
		return attr(name(value), attribute);
	}

	public static PythonCall call(PythonExpression function, PythonExpression... arguments) {
		return new PythonCall(SourceLocation.unknown(), function, Arrays.asList(arguments), Collections.emptyList());
	}

	public static PythonCall call(String function, PythonExpression... arguments) {
		return call(name(function), arguments);
	}

	public static PythonCall call(PythonExpression function, List<PythonExpression> arguments,
	                              PythonKeyword... keywords) {
		return new PythonCall(SourceLocation.unknown(), function, arguments, Arrays.asList(keywords));
	}

	public static PythonKeyword kw(String name, PythonExpression value) {
		return new PythonKeyword(SourceLocation.unknown(), name, value);
	}

	public static PythonBinOp binop(PythonExpression left, PythonBinaryOperator operator, PythonExpression right) {
		return new PythonBinOp(SourceLocation.unknown(), left, operator, right);
	}

	public static PythonBoolOp and(PythonExpression... values) {
		return new PythonBoolOp(SourceLocation.unknown(), PythonBooleanOperator.AND, Arrays.asList(values));
	}

	public static PythonBoolOp or(PythonExpression... values) {
		return new PythonBoolOp(SourceLocation.unknown(), PythonBooleanOperator.OR, Arrays.asList(values));
	}

	public static PythonUnaryOp not(PythonExpression operand) {
		return new PythonUnaryOp(SourceLocation.unknown(), PythonUnaryOperator.NOT, operand);
	}

	public static PythonUnaryOp unary(PythonUnaryOperator operator, PythonExpression operand) {
		return new PythonUnaryOp(SourceLocation.unknown(), operator, operand);
	}

	public static PythonCompare compare(PythonExpression left, PythonComparisonOperator operator,
	                                    PythonExpression right) {
		return new PythonCompare(SourceLocation.unknown(), left, Collections.singletonList(operator),
				Collections.singletonList(right));
	}

	public static PythonCompare compare(PythonExpression left, List<PythonComparisonOperator> operators,
	                                    List<PythonExpression> comparators) {
		return new PythonCompare(SourceLocation.unknown(), left, operators, comparators);
	}

	public static PythonCall isinstance(String anchor, PythonExpression type) {
		return call("isinstance", name(anchor), type);
	}

	public static PythonList list(PythonExpression... elements) {
		return new PythonList(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PythonTuple tuple(PythonExpression... elements) {
		return new PythonTuple(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PythonDict dict(List<PythonExpression> keys, List<PythonExpression> values) {
		return new PythonDict(SourceLocation.unknown(), keys, values);
	}

	public static PythonSubscript subscript(PythonExpression value, PythonExpression index) {
		return new PythonSubscript(SourceLocation.unknown(), value, index);
	}

	public static PythonComprehension listComp(PythonExpression element, PythonGenerator... generators) {
		return new PythonComprehension(SourceLocation.unknown(), PythonComprehension.Kind.LIST, element,
				Arrays.asList(generators));
	}

	public static PythonComprehension genExp(PythonExpression element, PythonGenerator... generators) {
		return new PythonComprehension(SourceLocation.unknown(), PythonComprehension.Kind.GENERATOR, element,
				Arrays.asList(generators));
	}

	public static PythonGenerator generator(String target, PythonExpression iterable,
	                                        PythonExpression... conditions) {
		return new PythonGenerator(SourceLocation.unknown(), name(target), iterable, Arrays.asList(conditions));
	}

	public static PythonUnsupportedExpression unsupportedExpr(String kind) {
		return new PythonUnsupportedExpression(SourceLocation.unknown(), kind);
	}
}
