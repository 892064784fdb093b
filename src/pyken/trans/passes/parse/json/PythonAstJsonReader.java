package pyken.trans.passes.parse.json;

import org.json.JSONArray;
import org.json.JSONObject;
import pyken.model.python.*;
import pyken.util.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts the JSON serialization of a CPython {@code ast.Module} into the Python model.
 *
 * Each node is an object whose {@code _type} member names its node class; the other members carry
 * the CPython field names. Node kinds with no model counterpart are kept as unsupported nodes.
 */
public class PythonAstJsonReader {

	private static final String TYPE = "_type";

	private final Path file;

	public PythonAstJsonReader(Path file) {
		this.file = file;
	}

	public PythonModule readModule(JSONObject node) throws AstFormatException {
		String type = typeOf(node);
		if (!type.equals("Module")) {
			throw new AstFormatException("expected a Module node at the top level, found " + type);
		}
		return new PythonModule(locationOf(node), readStatements(node.optJSONArray("body")));
	}

	private static String typeOf(JSONObject node) throws AstFormatException {
		String type = node.optString(TYPE, null);
		if (type == null) {
			throw new AstFormatException("AST node without a " + TYPE + " member: " + abbreviate(node));
		}
		return type;
	}

	private static String abbreviate(JSONObject node) {
		String text = node.toString();
		return text.length() > 80 ? text.substring(0, 77) + "..." : text;
	}

	private SourceLocation locationOf(JSONObject node) {
		int line = node.optInt("lineno", -1);
		int column = node.optInt("col_offset", -1);
		return new SourceLocation(file, line, node.optInt("end_lineno", line), column,
				node.optInt("end_col_offset", column));
	}

	private static JSONObject object(JSONObject node, String key) throws AstFormatException {
		JSONObject child = node.optJSONObject(key);
		if (child == null) {
			throw new AstFormatException(typeOf(node) + " node is missing its " + key + " member");
		}
		return child;
	}

	private static String string(JSONObject node, String key) throws AstFormatException {
		if (!node.has(key) || node.isNull(key)) {
			throw new AstFormatException(typeOf(node) + " node is missing its " + key + " member");
		}
		return node.getString(key);
	}

	private static String optionalString(JSONObject node, String key) {
		if (!node.has(key) || node.isNull(key)) {
			return null;
		}
		return node.getString(key);
	}

	private List<PythonStatement> readStatements(JSONArray array) throws AstFormatException {
		List<PythonStatement> result = new ArrayList<>();
		if (array == null) {
			return result;
		}
		for (int i = 0; i < array.length(); i++) {
			result.add(readStatement(array.getJSONObject(i)));
		}
		return result;
	}

	private List<PythonExpression> readExpressions(JSONArray array) throws AstFormatException {
		List<PythonExpression> result = new ArrayList<>();
		if (array == null) {
			return result;
		}
		for (int i = 0; i < array.length(); i++) {
			result.add(array.isNull(i) ? null : readExpression(array.getJSONObject(i)));
		}
		return result;
	}

	private PythonExpression optionalExpression(JSONObject node, String key) throws AstFormatException {
		JSONObject child = node.optJSONObject(key);
		return child == null ? null : readExpression(child);
	}

	private PythonExpression expression(JSONObject node, String key) throws AstFormatException {
		return readExpression(object(node, key));
	}

	public PythonStatement readStatement(JSONObject node) throws AstFormatException {
		SourceLocation location = locationOf(node);
		String type = typeOf(node);
		switch (type) {
			case "Import":
				return new PythonImport(location, readAliases(node.optJSONArray("names")));
			case "ImportFrom":
				return new PythonImportFrom(location, optionalString(node, "module"),
						readAliases(node.optJSONArray("names")));
			case "ClassDef":
				return new PythonClassDef(location, string(node, "name"),
						readExpressions(node.optJSONArray("bases")),
						readExpressions(node.optJSONArray("decorator_list")),
						readStatements(node.optJSONArray("body")));
			case "FunctionDef":
				return new PythonFunctionDef(location, string(node, "name"),
						readArguments(node.optJSONObject("args")),
						optionalExpression(node, "returns"),
						readExpressions(node.optJSONArray("decorator_list")),
						readStatements(node.optJSONArray("body")));
			case "Assign":
				return new PythonAssign(location, readExpressions(node.optJSONArray("targets")),
						expression(node, "value"));
			case "AnnAssign":
				return new PythonAnnAssign(location, expression(node, "target"), expression(node, "annotation"),
						optionalExpression(node, "value"));
			case "AugAssign": {
				PythonBinaryOperator operator = PythonBinaryOperator.fromNodeName(typeOf(object(node, "op")));
				if (operator == null) {
					return new PythonUnsupportedStatement(location, type);
				}
				return new PythonAugAssign(location, expression(node, "target"), operator, expression(node, "value"));
			}
			case "If":
				return new PythonIf(location, expression(node, "test"), readStatements(node.optJSONArray("body")),
						readStatements(node.optJSONArray("orelse")));
			case "Return":
				return new PythonReturn(location, optionalExpression(node, "value"));
			case "Assert":
				return new PythonAssert(location, expression(node, "test"), optionalExpression(node, "msg"));
			case "Raise":
				return new PythonRaise(location, optionalExpression(node, "exc"));
			case "Try":
				return new PythonTry(location, readStatements(node.optJSONArray("body")),
						readHandlers(node.optJSONArray("handlers")),
						readStatements(node.optJSONArray("orelse")),
						readStatements(node.optJSONArray("finalbody")));
			case "Expr":
				return new PythonExpressionStatement(location, expression(node, "value"));
			case "Pass":
				return new PythonPass(location);
			default:
				return new PythonUnsupportedStatement(location, type);
		}
	}

	private List<PythonAlias> readAliases(JSONArray array) throws AstFormatException {
		List<PythonAlias> result = new ArrayList<>();
		if (array == null) {
			return result;
		}
		for (int i = 0; i < array.length(); i++) {
			JSONObject alias = array.getJSONObject(i);
			result.add(new PythonAlias(locationOf(alias), string(alias, "name"), optionalString(alias, "asname")));
		}
		return result;
	}

	private List<PythonExceptHandler> readHandlers(JSONArray array) throws AstFormatException {
		List<PythonExceptHandler> result = new ArrayList<>();
		if (array == null) {
			return result;
		}
		for (int i = 0; i < array.length(); i++) {
			JSONObject handler = array.getJSONObject(i);
			result.add(new PythonExceptHandler(locationOf(handler), optionalExpression(handler, "type"),
					optionalString(handler, "name"), readStatements(handler.optJSONArray("body"))));
		}
		return result;
	}

	/**
	 * Flattens an {@code arguments} node: positional-only and regular parameters, with defaults aligned
	 * to the last of them, followed by keyword-only parameters.
	 */
	private List<PythonArgument> readArguments(JSONObject arguments) throws AstFormatException {
		List<PythonArgument> result = new ArrayList<>();
		if (arguments == null) {
			return result;
		}
		List<JSONObject> positional = new ArrayList<>();
		for (String key : new String[]{"posonlyargs", "args"}) {
			JSONArray array = arguments.optJSONArray(key);
			if (array != null) {
				for (int i = 0; i < array.length(); i++) {
					positional.add(array.getJSONObject(i));
				}
			}
		}
		List<PythonExpression> defaults = readExpressions(arguments.optJSONArray("defaults"));
		int firstDefault = positional.size() - defaults.size();
		for (int i = 0; i < positional.size(); i++) {
			PythonExpression defaultValue = i >= firstDefault ? defaults.get(i - firstDefault) : null;
			result.add(readArgument(positional.get(i), defaultValue));
		}
		JSONArray keywordOnly = arguments.optJSONArray("kwonlyargs");
		List<PythonExpression> keywordDefaults = readExpressions(arguments.optJSONArray("kw_defaults"));
		if (keywordOnly != null) {
			for (int i = 0; i < keywordOnly.length(); i++) {
				PythonExpression defaultValue = i < keywordDefaults.size() ? keywordDefaults.get(i) : null;
				result.add(readArgument(keywordOnly.getJSONObject(i), defaultValue));
			}
		}
		return result;
	}

	private PythonArgument readArgument(JSONObject argument, PythonExpression defaultValue) throws AstFormatException {
		return new PythonArgument(locationOf(argument), string(argument, "arg"),
				optionalExpression(argument, "annotation"), defaultValue);
	}

	public PythonExpression readExpression(JSONObject node) throws AstFormatException {
		SourceLocation location = locationOf(node);
		String type = typeOf(node);
		switch (type) {
			case "Constant":
			case "NameConstant":
				return readConstant(location, node.opt("value"));
			case "Num":
				return readConstant(location, node.opt("n"));
			case "Str":
			case "Bytes":
				return readConstant(location, node.opt("s"));
			case "Name":
				return new PythonName(location, string(node, "id"));
			case "Attribute":
				return new PythonAttribute(location, expression(node, "value"), string(node, "attr"));
			case "Call":
				return new PythonCall(location, expression(node, "func"), readExpressions(node.optJSONArray("args")),
						readKeywords(node.optJSONArray("keywords")));
			case "BinOp": {
				PythonBinaryOperator operator = PythonBinaryOperator.fromNodeName(typeOf(object(node, "op")));
				if (operator == null) {
					return new PythonUnsupportedExpression(location, type);
				}
				return new PythonBinOp(location, expression(node, "left"), operator, expression(node, "right"));
			}
			case "BoolOp": {
				PythonBooleanOperator operator = PythonBooleanOperator.fromNodeName(typeOf(object(node, "op")));
				if (operator == null) {
					return new PythonUnsupportedExpression(location, type);
				}
				return new PythonBoolOp(location, operator, readExpressions(node.optJSONArray("values")));
			}
			case "UnaryOp": {
				PythonUnaryOperator operator = PythonUnaryOperator.fromNodeName(typeOf(object(node, "op")));
				if (operator == null) {
					return new PythonUnsupportedExpression(location, type);
				}
				return new PythonUnaryOp(location, operator, expression(node, "operand"));
			}
			case "Compare": {
				List<PythonComparisonOperator> operators = new ArrayList<>();
				JSONArray ops = node.optJSONArray("ops");
				for (int i = 0; ops != null && i < ops.length(); i++) {
					PythonComparisonOperator operator = PythonComparisonOperator.fromNodeName(typeOf(ops.getJSONObject(i)));
					if (operator == null) {
						return new PythonUnsupportedExpression(location, type);
					}
					operators.add(operator);
				}
				List<PythonExpression> comparators = readExpressions(node.optJSONArray("comparators"));
				if (operators.isEmpty() || operators.size() != comparators.size()) {
					throw new AstFormatException("Compare node with " + operators.size() + " operators and " +
							comparators.size() + " comparators");
				}
				return new PythonCompare(location, expression(node, "left"), operators, comparators);
			}
			case "List":
				return new PythonList(location, readExpressions(node.optJSONArray("elts")));
			case "Tuple":
				return new PythonTuple(location, readExpressions(node.optJSONArray("elts")));
			case "Dict":
				return new PythonDict(location, readExpressions(node.optJSONArray("keys")),
						readExpressions(node.optJSONArray("values")));
			case "Subscript": {
				JSONObject slice = object(node, "slice");
				// before Python 3.9 the index is wrapped in an Index node
				if (typeOf(slice).equals("Index")) {
					slice = object(slice, "value");
				}
				return new PythonSubscript(location, expression(node, "value"), readExpression(slice));
			}
			case "ListComp":
				return new PythonComprehension(location, PythonComprehension.Kind.LIST, expression(node, "elt"),
						readGenerators(node.optJSONArray("generators")));
			case "GeneratorExp":
				return new PythonComprehension(location, PythonComprehension.Kind.GENERATOR, expression(node, "elt"),
						readGenerators(node.optJSONArray("generators")));
			default:
				return new PythonUnsupportedExpression(location, type);
		}
	}

	private PythonExpression readConstant(SourceLocation location, Object value) throws AstFormatException {
		if (value == null || value == JSONObject.NULL) {
			return new PythonNoneLiteral(location);
		}
		if (value instanceof Boolean) {
			return new PythonBooleanLiteral(location, (Boolean) value);
		}
		if (value instanceof Integer || value instanceof Long) {
			return new PythonIntegerLiteral(location, BigInteger.valueOf(((Number) value).longValue()));
		}
		if (value instanceof BigInteger) {
			return new PythonIntegerLiteral(location, (BigInteger) value);
		}
		if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
			return new PythonFloatLiteral(location, value.toString());
		}
		if (value instanceof String) {
			return new PythonStringLiteral(location, (String) value);
		}
		if (value instanceof JSONObject) {
			JSONObject encoded = (JSONObject) value;
			if ("bytes".equals(encoded.optString(TYPE)) && encoded.has("hex")) {
				return new PythonBytesLiteral(location, decodeHex(encoded.getString("hex")));
			}
		}
		return new PythonUnsupportedExpression(location, "Constant");
	}

	private static byte[] decodeHex(String hex) throws AstFormatException {
		if (hex.length() % 2 != 0) {
			throw new AstFormatException("odd number of hex digits in bytes constant: " + hex);
		}
		byte[] result = new byte[hex.length() / 2];
		for (int i = 0; i < result.length; i++) {
			int high = Character.digit(hex.charAt(2 * i), 16);
			int low = Character.digit(hex.charAt(2 * i + 1), 16);
			if (high < 0 || low < 0) {
				throw new AstFormatException("invalid hex digits in bytes constant: " + hex);
			}
			result[i] = (byte) ((high << 4) | low);
		}
		return result;
	}

	private List<PythonKeyword> readKeywords(JSONArray array) throws AstFormatException {
		if (array == null) {
			return Collections.emptyList();
		}
		List<PythonKeyword> result = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			JSONObject keyword = array.getJSONObject(i);
			result.add(new PythonKeyword(locationOf(keyword), optionalString(keyword, "arg"),
					expression(keyword, "value")));
		}
		return result;
	}

	private List<PythonGenerator> readGenerators(JSONArray array) throws AstFormatException {
		List<PythonGenerator> result = new ArrayList<>();
		if (array == null) {
			return result;
		}
		for (int i = 0; i < array.length(); i++) {
			JSONObject generator = array.getJSONObject(i);
			result.add(new PythonGenerator(locationOf(generator), expression(generator, "target"),
					expression(generator, "iter"), readExpressions(generator.optJSONArray("ifs"))));
		}
		return result;
	}
}
