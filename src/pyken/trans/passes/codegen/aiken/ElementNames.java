package pyken.trans.passes.codegen.aiken;

/**
 * Derives the element name used when a test pulls a single input or output out of a transaction,
 * e.g. {@code input_item} becomes {@code input} and {@code outputs} becomes {@code output}.
 */
public class ElementNames {

	private ElementNames() {}

	public static String normalize(String name) {
		if (name.endsWith("_item")) {
			return name.substring(0, name.length() - "_item".length());
		}
		for (String suffix : new String[]{"_input", "_output"}) {
			if (name.endsWith(suffix)) {
				return name.substring(0, name.length() - suffix.length());
			}
		}
		if (name.endsWith("s") && name.length() > 1) {
			return name.substring(0, name.length() - 1);
		}
		return name;
	}
}
