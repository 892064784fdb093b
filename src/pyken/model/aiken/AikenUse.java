package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

/**
 * {@code use a/b}, {@code use a/b as c} or {@code use a/b.{X, Y as Z}}. Imported names are kept in
 * their rendered form.
 */
public class AikenUse extends AikenDeclaration {

	private final String module;
	private final String alias;
	private final List<String> names;

	public AikenUse(String module, String alias, List<String> names) {
		this.module = module;
		this.alias = alias;
		this.names = names;
	}

	public String getModule() {
		return module;
	}

	public String getAlias() {
		return alias;
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenUse aikenUse = (AikenUse) o;
		return Objects.equals(module, aikenUse.module) &&
				Objects.equals(alias, aikenUse.alias) &&
				Objects.equals(names, aikenUse.names);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, alias, names);
	}
}
