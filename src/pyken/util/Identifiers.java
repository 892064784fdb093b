package pyken.util;

public class Identifiers {

	private Identifiers() {}

	/**
	 * Python code names classes and constructors in CamelCase, so a leading upper-case letter is taken
	 * to mean "this is a type or a constructor". This cannot tell a capitalized function from a
	 * constructor.
	 */
	public static boolean isCapitalized(String name) {
		return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
	}
}
