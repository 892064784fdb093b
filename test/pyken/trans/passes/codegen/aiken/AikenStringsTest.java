package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class AikenStringsTest {

	@Test
	public void embeddedQuotesSurviveQuoting() {
		String original = "he said \"pay me\" and left \\ twice";
		String quoted = AikenStrings.quote(original);
		assertThat(quoted.charAt(0), is('"'));
		assertThat(quoted.charAt(quoted.length() - 1), is('"'));
		assertThat(AikenStrings.unquote(quoted), is(original));
	}

	@Test
	public void controlCharacters() {
		String original = "line one\nline\ttwo";
		assertThat(AikenStrings.quote(original), is("\"line one\\nline\\ttwo\""));
		assertThat(AikenStrings.unquote(AikenStrings.quote(original)), is(original));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unquoteRejectsNonStrings() {
		AikenStrings.unquote("42");
	}

	@Test
	public void bytes() {
		assertThat(AikenStrings.quoteBytes("token".getBytes(StandardCharsets.UTF_8)), is("\"token\""));
		assertThat(AikenStrings.quoteBytes(new byte[]{0x00, (byte) 0xff, 0x10}), is("#\"00ff10\""));
		assertThat(AikenStrings.quoteBytes(new byte[0]), is("\"\""));
	}

}
