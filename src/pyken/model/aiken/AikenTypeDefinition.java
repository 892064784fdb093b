package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenTypeDefinition extends AikenDeclaration {

	private final String name;
	private final List<AikenConstructor> constructors;

	public AikenTypeDefinition(String name, List<AikenConstructor> constructors) {
		this.name = name;
		this.constructors = constructors;
	}

	public String getName() {
		return name;
	}

	public List<AikenConstructor> getConstructors() {
		return constructors;
	}

	/**
	 * @return whether this is a single-constructor record written in the {@code pub type Foo { a: Int }}
	 * shorthand
	 */
	public boolean isRecordShorthand() {
		return constructors.size() == 1 &&
				constructors.get(0).getName().equals(name) &&
				!constructors.get(0).getFields().isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(AikenDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenTypeDefinition that = (AikenTypeDefinition) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(constructors, that.constructors);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, constructors);
	}
}
