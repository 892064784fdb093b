package pyken.model.python;

public enum PythonComparisonOperator {
	EQ("Eq"),
	NOT_EQ("NotEq"),
	LT("Lt"),
	LT_E("LtE"),
	GT("Gt"),
	GT_E("GtE"),
	IS("Is"),
	IS_NOT("IsNot"),
	IN("In"),
	NOT_IN("NotIn");

	private final String nodeName;

	PythonComparisonOperator(String nodeName) {
		this.nodeName = nodeName;
	}

	public String getNodeName() {
		return nodeName;
	}

	public static PythonComparisonOperator fromNodeName(String nodeName) {
		for (PythonComparisonOperator op : values()) {
			if (op.nodeName.equals(nodeName)) {
				return op;
			}
		}
		return null;
	}
}
