package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenModule extends AikenNode {

	private final List<AikenDeclaration> declarations;

	public AikenModule(List<AikenDeclaration> declarations) {
		this.declarations = declarations;
	}

	public List<AikenDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenModule that = (AikenModule) o;
		return Objects.equals(declarations, that.declarations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(declarations);
	}
}
