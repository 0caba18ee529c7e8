package texparse.model;

import texparse.Unreachable;
import texparse.formatters.IndentingWriter;
import texparse.formatters.NodeFormattingVisitor;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.util.SourceSpanned;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The base class for every node of a parsed LaTeX tree. A node knows the range of source it was
 * parsed from and the parsing state that was in force at the time.
 *
 * <p>Equality is structural and includes spans, but not the parsing state.</p>
 */
public abstract class LatexNode implements SourceSpanned {
	private final SourceSpan span;
	private final ParsingState parsingState;

	public LatexNode(SourceSpan span, ParsingState parsingState) {
		this.span = span;
		this.parsingState = parsingState;
	}

	@Override
	public SourceSpan getSpan() {
		return span;
	}

	public ParsingState getParsingState() {
		return parsingState;
	}

	/**
	 * @return the exact source text this node was parsed from
	 */
	public String getLatexVerbatim() {
		return span.substring(parsingState.getSource());
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new NodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E;

}
