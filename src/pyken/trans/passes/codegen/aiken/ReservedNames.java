package pyken.trans.passes.codegen.aiken;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Fixed renames for the names Python validators use for the datum and the redeemer. They apply
 * everywhere, regardless of scope or type, and are idempotent.
 */
public class ReservedNames {

	private ReservedNames() {}

	public static final String OPTIONAL_PAYLOAD_TOKEN = "None";
	public static final String AUXILIARY_DATA_TOKEN = "Void";

	private static final Set<String> OPTIONAL_PAYLOAD_NAMES = new HashSet<>(Arrays.asList("_datum", "datum", "data"));
	private static final Set<String> AUXILIARY_DATA_NAMES = new HashSet<>(Arrays.asList("_redeemer", "redeemer"));
	private static final Set<String> OPTIONAL_PAYLOAD_CALLEES = new HashSet<>(Arrays.asList("Datum", "Data"));
	private static final Set<String> AUXILIARY_DATA_CALLEES = new HashSet<>(Arrays.asList("Redeemer"));

	/**
	 * Normalizes an identifier or attribute name.
	 */
	public static String normalize(String name) {
		if (OPTIONAL_PAYLOAD_NAMES.contains(name)) {
			return OPTIONAL_PAYLOAD_TOKEN;
		}
		if (AUXILIARY_DATA_NAMES.contains(name)) {
			return AUXILIARY_DATA_TOKEN;
		}
		return name;
	}

	public static boolean isReserved(String name) {
		return OPTIONAL_PAYLOAD_NAMES.contains(name) || AUXILIARY_DATA_NAMES.contains(name);
	}

	public static boolean isDatumName(String name) {
		return "_datum".equals(name) || "datum".equals(name);
	}

	public static boolean isRedeemerName(String name) {
		return AUXILIARY_DATA_NAMES.contains(name);
	}

	/**
	 * @return the token a call to this callee collapses to, or null if the callee is not reserved
	 */
	public static String normalizeCallee(String calleeName) {
		if (OPTIONAL_PAYLOAD_CALLEES.contains(calleeName)) {
			return OPTIONAL_PAYLOAD_TOKEN;
		}
		if (AUXILIARY_DATA_CALLEES.contains(calleeName)) {
			return AUXILIARY_DATA_TOKEN;
		}
		return null;
	}
}
