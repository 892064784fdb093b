package pyken.model.python;

public enum PythonBooleanOperator {
	AND("And"),
	OR("Or");

	private final String nodeName;

	PythonBooleanOperator(String nodeName) {
		this.nodeName = nodeName;
	}

	public String getNodeName() {
		return nodeName;
	}

	public static PythonBooleanOperator fromNodeName(String nodeName) {
		for (PythonBooleanOperator op : values()) {
			if (op.nodeName.equals(nodeName)) {
				return op;
			}
		}
		return null;
	}
}
