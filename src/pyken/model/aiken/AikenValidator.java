package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenValidator extends AikenDeclaration {

	private final String name;
	private final List<AikenParameter> parameters;
	private final List<AikenHandler> handlers;

	public AikenValidator(String name, List<AikenParameter> parameters, List<AikenHandler> handlers) {
		this.name = name;
		this.parameters = parameters;
		this.handlers = handlers;
	}

	public String getName() {
		return name;
	}

	public List<AikenParameter> getParameters() {
		return parameters;
	}

	public List<AikenHandler> getHandlers() {
		return handlers;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenValidator that = (AikenValidator) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(handlers, that.handlers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, handlers);
	}
}
