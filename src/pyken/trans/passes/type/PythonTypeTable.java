package pyken.trans.passes.type;

import pyken.model.python.*;
import pyken.model.type.TypeSymbol;
import pyken.util.Identifiers;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Python type annotations to Aiken type names.
 */
public class PythonTypeTable {

	private PythonTypeTable() {}

	private static final Map<String, String> TABLE;
	static {
		Map<String, String> table = new HashMap<>();
		table.put("int", "Int");
		table.put("float", "Int");
		table.put("bool", "Bool");
		table.put("str", "String");
		table.put("bytes", "ByteArray");
		table.put("bytearray", "ByteArray");
		table.put("None", "Void");
		table.put("Any", TypeSymbol.WILDCARD);
		table.put("object", TypeSymbol.WILDCARD);
		table.put("Data", TypeSymbol.WILDCARD);
		table.put("dict", "Dict<Data, Data>");
		table.put("list", "List<Data>");
		table.put("tuple", "Pair<Data, Data>");
		table.put("Datum", "Option<Data>");
		table.put("Redeemer", "Data");
		table.put("Context", "ScriptContext");
		TABLE = Collections.unmodifiableMap(table);
	}

	/**
	 * Looks a bare type name up in the table. Unknown capitalized names are presumed to be records
	 * declared elsewhere and pass through unchanged; everything else becomes the wildcard.
	 */
	public static String lookup(String pythonName) {
		String mapped = TABLE.get(pythonName);
		if (mapped != null) {
			return mapped;
		}
		if (Identifiers.isCapitalized(pythonName)) {
			return pythonName;
		}
		return TypeSymbol.WILDCARD;
	}

	public static String annotationType(PythonExpression annotation) {
		return annotation.accept(new AnnotationVisitor());
	}

	private static String genericType(PythonSubscript subscript) {
		String container;
		if (subscript.getValue() instanceof PythonName) {
			container = ((PythonName) subscript.getValue()).getId();
		} else if (subscript.getValue() instanceof PythonAttribute) {
			container = ((PythonAttribute) subscript.getValue()).getAttribute();
		} else {
			return TypeSymbol.WILDCARD;
		}
		List<PythonExpression> parameters;
		if (subscript.getIndex() instanceof PythonTuple) {
			parameters = ((PythonTuple) subscript.getIndex()).getElements();
		} else {
			parameters = Collections.singletonList(subscript.getIndex());
		}
		switch (container) {
			case "Optional":
				if (parameters.size() == 1) {
					return "Option<" + annotationType(parameters.get(0)) + ">";
				}
				break;
			case "List":
			case "list":
				if (parameters.size() == 1) {
					return "List<" + annotationType(parameters.get(0)) + ">";
				}
				break;
			case "Dict":
			case "dict":
				if (parameters.size() == 2) {
					return "Dict<" + annotationType(parameters.get(0)) + ", " +
							annotationType(parameters.get(1)) + ">";
				}
				break;
			case "Tuple":
			case "tuple":
				if (parameters.size() == 2) {
					return "Pair<" + annotationType(parameters.get(0)) + ", " +
							annotationType(parameters.get(1)) + ">";
				}
				break;
		}
		return TypeSymbol.WILDCARD;
	}

	private static class AnnotationVisitor extends PythonExpressionVisitor<String, RuntimeException> {

		@Override
		public String visit(PythonBooleanLiteral pythonBooleanLiteral) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonIntegerLiteral pythonIntegerLiteral) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonFloatLiteral pythonFloatLiteral) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonStringLiteral pythonStringLiteral) {
			// forward reference, e.g. "Foo"
			return lookup(pythonStringLiteral.getValue());
		}

		@Override
		public String visit(PythonBytesLiteral pythonBytesLiteral) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonNoneLiteral pythonNoneLiteral) {
			return lookup("None");
		}

		@Override
		public String visit(PythonName pythonName) {
			return lookup(pythonName.getId());
		}

		@Override
		public String visit(PythonAttribute pythonAttribute) {
			return lookup(pythonAttribute.getAttribute());
		}

		@Override
		public String visit(PythonCall pythonCall) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonBinOp pythonBinOp) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonBoolOp pythonBoolOp) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonUnaryOp pythonUnaryOp) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonCompare pythonCompare) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonList pythonList) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonTuple pythonTuple) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonDict pythonDict) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonSubscript pythonSubscript) {
			return genericType(pythonSubscript);
		}

		@Override
		public String visit(PythonComprehension pythonComprehension) {
			return TypeSymbol.WILDCARD;
		}

		@Override
		public String visit(PythonUnsupportedExpression pythonUnsupportedExpression) {
			return TypeSymbol.WILDCARD;
		}
	}
}
