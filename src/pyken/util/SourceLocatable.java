package pyken.util;

/**
 * 
 * A common abstract base for AST nodes that should be traceable back to
 * their original location in the input.
 *
 */
public abstract class SourceLocatable {
	
	public abstract SourceLocation getLocation();

}
