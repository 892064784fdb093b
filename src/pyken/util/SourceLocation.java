package pyken.util;

import pyken.formatters.IndentingWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A line/column span in an input file. Lines are 1-based and columns are 0-based, following the
 * positions the Python parser records on each node.
 */
public class SourceLocation {
	private static final SourceLocation UNKNOWN = new SourceLocation(null, -1, -1, -1, -1);

	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return UNKNOWN;
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	/**
	 * Writes "at line:col", widened to a range when the node spans several columns or lines.
	 * Columns are printed 1-based.
	 */
	public void writePretty(IndentingWriter out) throws IOException {
		if (isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		StringBuilder span = new StringBuilder("at ").append(startLine).append(':').append(startColumn + 1);
		if (startLine != endLine) {
			span.append('-').append(endLine).append(':').append(endColumn);
		} else if (startColumn != endColumn) {
			span.append('-').append(endColumn);
		}
		if (file != null) {
			span.append(" in file ").append(file);
		}
		out.write(span.toString());
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SourceLocation that = (SourceLocation) o;
		return startLine == that.startLine && endLine == that.endLine && startColumn == that.startColumn &&
				endColumn == that.endColumn && Objects.equals(file, that.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public String toString() {
		return isUnknown() ? "SourceLocation [UNKNOWN]" : "SourceLocation [" + file + " " + startLine + ":" + startColumn + "]";
	}

}
