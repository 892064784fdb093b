package pyken.model.python;

/**
 * Binary operators, named after the CPython operator node classes.
 */
public enum PythonBinaryOperator {
	ADD("Add"),
	SUB("Sub"),
	MULT("Mult"),
	DIV("Div"),
	FLOOR_DIV("FloorDiv"),
	MOD("Mod"),
	POW("Pow"),
	MAT_MULT("MatMult"),
	L_SHIFT("LShift"),
	R_SHIFT("RShift"),
	BIT_OR("BitOr"),
	BIT_XOR("BitXor"),
	BIT_AND("BitAnd");

	private final String nodeName;

	PythonBinaryOperator(String nodeName) {
		this.nodeName = nodeName;
	}

	public String getNodeName() {
		return nodeName;
	}

	public static PythonBinaryOperator fromNodeName(String nodeName) {
		for (PythonBinaryOperator op : values()) {
			if (op.nodeName.equals(nodeName)) {
				return op;
			}
		}
		return null;
	}
}
