package pyken.trans.passes.type;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;

public class TypeUnificationTest {

	private static final TypeSymbol INT = new TypeSymbol("Int", TypeProvenance.HEURISTIC);
	private static final TypeSymbol STRING = new TypeSymbol("String", TypeProvenance.HEURISTIC);

	@Test
	public void equalTypesUnifyToThemselves() {
		assertThat(TypeUnification.unify(INT, new TypeSymbol("Int", TypeProvenance.HEURISTIC)), is(INT));
	}

	@Test
	public void wildcardYields() {
		assertThat(TypeUnification.unify(TypeSymbol.wildcard(), STRING), is(STRING));
		assertThat(TypeUnification.unify(STRING, TypeSymbol.wildcard()), is(STRING));
	}

	@Test
	public void conflictDegradesToWildcard() {
		TypeSymbol unified = TypeUnification.unify(INT, STRING);
		assertTrue(unified.isWildcard());
		assertThat(unified.getProvenance(), is(TypeProvenance.FALLBACK));
	}

	@Test
	public void commutative() {
		assertThat(TypeUnification.unify(INT, STRING), is(TypeUnification.unify(STRING, INT)));
		assertThat(TypeUnification.unify(INT, TypeSymbol.wildcard()),
				is(TypeUnification.unify(TypeSymbol.wildcard(), INT)));
	}

}
