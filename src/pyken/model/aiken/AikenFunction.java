package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenFunction extends AikenDeclaration {

	private final String name;
	private final List<AikenParameter> parameters;
	private final String returnType;
	private final List<AikenStatement> body;

	public AikenFunction(String name, List<AikenParameter> parameters, String returnType,
	                     List<AikenStatement> body) {
		this.name = name;
		this.parameters = parameters;
		this.returnType = returnType;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<AikenParameter> getParameters() {
		return parameters;
	}

	/**
	 * @return the return type annotation, or null when none is written
	 */
	public String getReturnType() {
		return returnType;
	}

	public List<AikenStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(AikenDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AikenFunction that = (AikenFunction) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(returnType, that.returnType) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, returnType, body);
	}
}
