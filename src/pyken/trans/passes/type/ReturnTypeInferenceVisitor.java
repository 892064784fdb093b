package pyken.trans.passes.type;

import pyken.model.python.*;
import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Types a returned expression without any knowledge of the names it mentions. Returns null when the
 * type cannot be told from the expression alone.
 */
public class ReturnTypeInferenceVisitor extends PythonExpressionVisitor<String, RuntimeException> {

	/**
	 * Infers a function's return type from the values of its return statements, both at the top level
	 * of the body and inside if/else branches. Values of unknown type are skipped and the rest are
	 * unified.
	 *
	 * @return the inferred type, or null when no returned value has a known type
	 */
	public static TypeSymbol inferReturnType(List<PythonStatement> body) {
		List<PythonExpression> values = new ArrayList<>();
		collectReturnValues(body, values);
		TypeSymbol result = null;
		for (PythonExpression value : values) {
			String type = value.accept(new ReturnTypeInferenceVisitor());
			if (type == null) {
				continue;
			}
			TypeSymbol symbol = new TypeSymbol(type, TypeProvenance.HEURISTIC);
			result = result == null ? symbol : TypeUnification.unify(result, symbol);
			if (result.getProvenance() == TypeProvenance.FALLBACK) {
				// a conflict is final, later values must not narrow it again
				break;
			}
		}
		return result;
	}

	private static void collectReturnValues(List<PythonStatement> body, List<PythonExpression> values) {
		for (PythonStatement statement : body) {
			if (statement instanceof PythonReturn) {
				PythonExpression value = ((PythonReturn) statement).getValue();
				if (value != null) {
					values.add(value);
				}
			} else if (statement instanceof PythonIf) {
				collectReturnValues(((PythonIf) statement).getBody(), values);
				collectReturnValues(((PythonIf) statement).getOrElse(), values);
			}
		}
	}

	@Override
	public String visit(PythonBooleanLiteral pythonBooleanLiteral) {
		return pythonBooleanLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonIntegerLiteral pythonIntegerLiteral) {
		return pythonIntegerLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonFloatLiteral pythonFloatLiteral) {
		return pythonFloatLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonStringLiteral pythonStringLiteral) {
		return pythonStringLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonBytesLiteral pythonBytesLiteral) {
		return pythonBytesLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonNoneLiteral pythonNoneLiteral) {
		return pythonNoneLiteral.accept(new LiteralTypeVisitor());
	}

	@Override
	public String visit(PythonName pythonName) {
		return null;
	}

	@Override
	public String visit(PythonAttribute pythonAttribute) {
		return null;
	}

	@Override
	public String visit(PythonCall pythonCall) {
		if (pythonCall.getFunction() instanceof PythonName) {
			switch (((PythonName) pythonCall.getFunction()).getId()) {
				case "int":
					return "Int";
				case "str":
					return "String";
				case "bool":
					return "Bool";
			}
		}
		return null;
	}

	@Override
	public String visit(PythonBinOp pythonBinOp) {
		String left = pythonBinOp.getLeft().accept(this);
		String right = pythonBinOp.getRight().accept(this);
		if (pythonBinOp.getOperator() == PythonBinaryOperator.ADD) {
			// string concatenation or numeric addition
			if (left != null && (right == null || left.equals(right))) {
				return left;
			}
			if (right != null && left == null) {
				return right;
			}
		}
		if ("Int".equals(left) || "Int".equals(right)) {
			return "Int";
		}
		return null;
	}

	@Override
	public String visit(PythonBoolOp pythonBoolOp) {
		return "Bool";
	}

	@Override
	public String visit(PythonUnaryOp pythonUnaryOp) {
		return pythonUnaryOp.getOperand().accept(this);
	}

	@Override
	public String visit(PythonCompare pythonCompare) {
		return "Bool";
	}

	@Override
	public String visit(PythonList pythonList) {
		return null;
	}

	@Override
	public String visit(PythonTuple pythonTuple) {
		return null;
	}

	@Override
	public String visit(PythonDict pythonDict) {
		return null;
	}

	@Override
	public String visit(PythonSubscript pythonSubscript) {
		return null;
	}

	@Override
	public String visit(PythonComprehension pythonComprehension) {
		return null;
	}

	@Override
	public String visit(PythonUnsupportedExpression pythonUnsupportedExpression) {
		return null;
	}
}
