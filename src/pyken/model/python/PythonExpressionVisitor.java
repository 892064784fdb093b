package pyken.model.python;

public abstract class PythonExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(PythonBooleanLiteral pythonBooleanLiteral) throws E;
	public abstract T visit(PythonIntegerLiteral pythonIntegerLiteral) throws E;
	public abstract T visit(PythonFloatLiteral pythonFloatLiteral) throws E;
	public abstract T visit(PythonStringLiteral pythonStringLiteral) throws E;
	public abstract T visit(PythonBytesLiteral pythonBytesLiteral) throws E;
	public abstract T visit(PythonNoneLiteral pythonNoneLiteral) throws E;
	public abstract T visit(PythonName pythonName) throws E;
	public abstract T visit(PythonAttribute pythonAttribute) throws E;
	public abstract T visit(PythonCall pythonCall) throws E;
	public abstract T visit(PythonBinOp pythonBinOp) throws E;
	public abstract T visit(PythonBoolOp pythonBoolOp) throws E;
	public abstract T visit(PythonUnaryOp pythonUnaryOp) throws E;
	public abstract T visit(PythonCompare pythonCompare) throws E;
	public abstract T visit(PythonList pythonList) throws E;
	public abstract T visit(PythonTuple pythonTuple) throws E;
	public abstract T visit(PythonDict pythonDict) throws E;
	public abstract T visit(PythonSubscript pythonSubscript) throws E;
	public abstract T visit(PythonComprehension pythonComprehension) throws E;
	public abstract T visit(PythonUnsupportedExpression pythonUnsupportedExpression) throws E;
}
