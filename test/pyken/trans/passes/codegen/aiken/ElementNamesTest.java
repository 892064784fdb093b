package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class ElementNamesTest {

	@Test
	public void suffixes() {
		assertThat(ElementNames.normalize("input_item"), is("input"));
		assertThat(ElementNames.normalize("script_input"), is("script"));
		assertThat(ElementNames.normalize("change_output"), is("change"));
		assertThat(ElementNames.normalize("outputs"), is("output"));
		assertThat(ElementNames.normalize("s"), is("s"));
		assertThat(ElementNames.normalize("first"), is("first"));
	}

}
