package pyken.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line with the current indentation. Lines always end in "\n" so that
 * emitted Aiken is identical across platforms.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";
	private static final int STEP = 2;

	private final Writer out;
	private int depth = 0;
	private boolean atLineStart = false;

	/**
	 * Restores the enclosing indentation when closed, so nested blocks can be written with
	 * try-with-resources.
	 */
	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;

		private Indent(IndentingWriter writer) {
			this.writer = writer;
		}

		@Override
		public void close() {
			writer.depth -= STEP;
		}

	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public Indent indent() {
		depth += STEP;
		return new Indent(this);
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (atLineStart) {
				// blank lines carry no trailing indentation
				if (!data.startsWith(LF, start)) {
					for (int i = 0; i < depth; ++i) {
						out.write(' ');
					}
				}
				atLineStart = false;
			}
			int next = data.indexOf(LF, start);
			if (next == -1) {
				out.write(data, start, data.length() - start);
				return;
			}
			out.write(data, start, next + LF.length() - start);
			start = next + LF.length();
			atLineStart = true;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
