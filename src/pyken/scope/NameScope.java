package pyken.scope;

import java.util.HashMap;
import java.util.Map;

/**
 * Renames local to one declaration's emission. A fresh scope is created for each declaration and
 * passed explicitly to whatever renders its body, so no rename can leak into another declaration.
 */
public class NameScope {

	private final Map<String, String> renames;

	public NameScope() {
		this.renames = new HashMap<>();
	}

	public void bind(String sourceName, String targetName) {
		renames.put(sourceName, targetName);
	}

	/**
	 * @return the name references to sourceName should use; sourceName itself when it was never renamed
	 */
	public String resolve(String sourceName) {
		return renames.getOrDefault(sourceName, sourceName);
	}
}
