package pyken.model.aiken;

import java.util.List;
import java.util.Objects;

public class AikenTest extends AikenDeclaration {

	private final String name;
	private final List<AikenStatement> body;

	public AikenTest(String name, List<AikenStatement> body) {
		this.name = name;
		this.body = body;
	}

	public String getName() {
		return name;
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
		AikenTest aikenTest = (AikenTest) o;
		return Objects.equals(name, aikenTest.name) &&
				Objects.equals(body, aikenTest.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, body);
	}
}
