package pyken.trans.passes.codegen.aiken;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public class AikenStrings {

	private AikenStrings() {}

	private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

	public static String quote(String value) {
		return JSONObject.quote(value);
	}

	/**
	 * Inverse of {@link #quote(String)}.
	 *
	 * @throws IllegalArgumentException if the text is not a quoted string
	 */
	public static String unquote(String quoted) {
		try {
			Object value = new JSONTokener(quoted).nextValue();
			if (!(value instanceof String)) {
				throw new IllegalArgumentException("not a quoted string: " + quoted);
			}
			return (String) value;
		} catch (JSONException e) {
			throw new IllegalArgumentException("not a quoted string: " + quoted, e);
		}
	}

	/**
	 * Byte strings holding valid UTF-8 are written as text, anything else as a hex byte array.
	 */
	public static String quoteBytes(byte[] value) {
		try {
			String text = StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(value))
					.toString();
			return quote(text);
		} catch (CharacterCodingException e) {
			StringBuilder hex = new StringBuilder("#\"");
			for (byte b : value) {
				hex.append(HEX_DIGITS[(b >> 4) & 0xf]);
				hex.append(HEX_DIGITS[b & 0xf]);
			}
			hex.append('"');
			return hex.toString();
		}
	}
}
