package pyken.model.python;

public abstract class PythonStatementVisitor<T, E extends Throwable> {
	public abstract T visit(PythonImport pythonImport) throws E;
	public abstract T visit(PythonImportFrom pythonImportFrom) throws E;
	public abstract T visit(PythonClassDef pythonClassDef) throws E;
	public abstract T visit(PythonFunctionDef pythonFunctionDef) throws E;
	public abstract T visit(PythonAssign pythonAssign) throws E;
	public abstract T visit(PythonAnnAssign pythonAnnAssign) throws E;
	public abstract T visit(PythonAugAssign pythonAugAssign) throws E;
	public abstract T visit(PythonIf pythonIf) throws E;
	public abstract T visit(PythonReturn pythonReturn) throws E;
	public abstract T visit(PythonAssert pythonAssert) throws E;
	public abstract T visit(PythonRaise pythonRaise) throws E;
	public abstract T visit(PythonTry pythonTry) throws E;
	public abstract T visit(PythonExpressionStatement pythonExpressionStatement) throws E;
	public abstract T visit(PythonPass pythonPass) throws E;
	public abstract T visit(PythonUnsupportedStatement pythonUnsupportedStatement) throws E;
}
