package pyken.model.python;

public enum PythonUnaryOperator {
	NOT("Not"),
	U_SUB("USub"),
	U_ADD("UAdd"),
	INVERT("Invert");

	private final String nodeName;

	PythonUnaryOperator(String nodeName) {
		this.nodeName = nodeName;
	}

	public String getNodeName() {
		return nodeName;
	}

	public static PythonUnaryOperator fromNodeName(String nodeName) {
		for (PythonUnaryOperator op : values()) {
			if (op.nodeName.equals(nodeName)) {
				return op;
			}
		}
		return null;
	}
}
