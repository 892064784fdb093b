package pyken.trans.passes.type;

import pyken.model.python.*;

import java.util.List;

/**
 * Guesses the type of a name from how a body uses it. The first matching use in breadth-first order
 * wins:
 * <ul>
 *     <li>tested directly by an if, or used as a boolean operand: Bool</li>
 *     <li>compared against a literal: that literal's type</li>
 *     <li>combined with a literal by an arithmetic operator: that literal's type</li>
 * </ul>
 */
public class ParameterUsageScan {

	private ParameterUsageScan() {}

	public static String scan(String name, List<PythonStatement> body) {
		for (PythonNode node : PythonWalk.walk(body)) {
			if (node instanceof PythonIf) {
				PythonExpression test = ((PythonIf) node).getTest();
				if (isName(test, name)) {
					return "Bool";
				}
			} else if (node instanceof PythonBoolOp) {
				for (PythonExpression value : ((PythonBoolOp) node).getValues()) {
					if (isName(value, name)) {
						return "Bool";
					}
				}
			} else if (node instanceof PythonCompare) {
				PythonCompare compare = (PythonCompare) node;
				if (isName(compare.getLeft(), name)) {
					for (PythonExpression comparator : compare.getComparators()) {
						String type = literalType(comparator);
						if (type != null) {
							return type;
						}
					}
				}
				for (PythonExpression comparator : compare.getComparators()) {
					if (isName(comparator, name)) {
						String type = literalType(compare.getLeft());
						if (type != null) {
							return type;
						}
					}
				}
			} else if (node instanceof PythonBinOp) {
				PythonBinOp binOp = (PythonBinOp) node;
				if (isName(binOp.getLeft(), name)) {
					String type = literalType(binOp.getRight());
					if (type != null) {
						return type;
					}
				}
				if (isName(binOp.getRight(), name)) {
					String type = literalType(binOp.getLeft());
					if (type != null) {
						return type;
					}
				}
			}
		}
		return null;
	}

	private static boolean isName(PythonExpression expression, String name) {
		return expression instanceof PythonName && ((PythonName) expression).getId().equals(name);
	}

	private static String literalType(PythonExpression expression) {
		return expression.accept(new LiteralTypeVisitor());
	}
}
