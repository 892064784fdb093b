package pyken.trans.passes.type;

import pyken.model.python.*;

/**
 * Types a literal by its kind. Anything that is not a literal yields null.
 */
public class LiteralTypeVisitor extends PythonExpressionVisitor<String, RuntimeException> {

	@Override
	public String visit(PythonBooleanLiteral pythonBooleanLiteral) {
		return "Bool";
	}

	@Override
	public String visit(PythonIntegerLiteral pythonIntegerLiteral) {
		return "Int";
	}

	@Override
	public String visit(PythonFloatLiteral pythonFloatLiteral) {
		// Aiken has no floating-point type
		return "Int";
	}

	@Override
	public String visit(PythonStringLiteral pythonStringLiteral) {
		return "String";
	}

	@Override
	public String visit(PythonBytesLiteral pythonBytesLiteral) {
		return "ByteArray";
	}

	@Override
	public String visit(PythonNoneLiteral pythonNoneLiteral) {
		return "Void";
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
		return null;
	}

	@Override
	public String visit(PythonBinOp pythonBinOp) {
		return null;
	}

	@Override
	public String visit(PythonBoolOp pythonBoolOp) {
		return null;
	}

	@Override
	public String visit(PythonUnaryOp pythonUnaryOp) {
		return null;
	}

	@Override
	public String visit(PythonCompare pythonCompare) {
		return null;
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
