package pyken.model.aiken;

import pyken.Unreachable;
import pyken.formatters.AikenNodeFormattingVisitor;
import pyken.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

public abstract class AikenNode {

	public abstract <T, E extends Throwable> T accept(AikenNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new AikenNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
