package pyken.model.type;

/**
 * Which signal a resolved type came from, in decreasing order of trust.
 */
public enum TypeProvenance {
	ANNOTATION,
	DEFAULT_VALUE,
	HEURISTIC,
	FALLBACK,
}
