package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;

import org.junit.Test;

public class ReservedNamesTest {

	@Test
	public void fixedRenames() {
		assertThat(ReservedNames.normalize("_datum"), is(ReservedNames.OPTIONAL_PAYLOAD_TOKEN));
		assertThat(ReservedNames.normalize("datum"), is(ReservedNames.OPTIONAL_PAYLOAD_TOKEN));
		assertThat(ReservedNames.normalize("data"), is(ReservedNames.OPTIONAL_PAYLOAD_TOKEN));
		assertThat(ReservedNames.normalize("redeemer"), is(ReservedNames.AUXILIARY_DATA_TOKEN));
		assertThat(ReservedNames.normalize("_redeemer"), is(ReservedNames.AUXILIARY_DATA_TOKEN));
		assertThat(ReservedNames.normalize("owner"), is("owner"));
	}

	@Test
	public void idempotent() {
		for (String name : Arrays.asList("_datum", "datum", "data", "redeemer", "_redeemer", "owner", "None", "Void")) {
			String once = ReservedNames.normalize(name);
			assertThat(ReservedNames.normalize(once), is(once));
		}
	}

	@Test
	public void callees() {
		assertThat(ReservedNames.normalizeCallee("Datum"), is("None"));
		assertThat(ReservedNames.normalizeCallee("Data"), is("None"));
		assertThat(ReservedNames.normalizeCallee("Redeemer"), is("Void"));
		assertThat(ReservedNames.normalizeCallee("Order"), is(nullValue()));
	}

	@Test
	public void handlerParameterRoles() {
		assertTrue(ReservedNames.isDatumName("_datum"));
		assertFalse(ReservedNames.isDatumName("data"));
		assertTrue(ReservedNames.isRedeemerName("redeemer"));
		assertFalse(ReservedNames.isRedeemerName("ctx"));
	}

}
