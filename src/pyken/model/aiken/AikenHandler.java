package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenHandler extends AikenNode {

	private final String name;
	private final List<AikenParameter> parameters;
	private final List<AikenStatement> body;

	public AikenHandler(String name, List<AikenParameter> parameters, List<AikenStatement> body) {
		this.name = name;
		this.parameters = parameters;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<AikenParameter> getParameters() {
		return parameters;
	}

	public List<AikenStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenHandler that = (AikenHandler) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, body);
	}
}
