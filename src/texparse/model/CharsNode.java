package texparse.model;

import texparse.state.ParsingState;
import texparse.util.SourceSpan;

/**
 * A run of plain characters, including any whitespace between other nodes.
 */
public class CharsNode extends LatexNode {
	private final String chars;

	public CharsNode(SourceSpan span, ParsingState parsingState, String chars) {
		super(span, parsingState);
		this.chars = chars;
	}

	public String getChars() {
		return chars;
	}

	public boolean isWhitespace() {
		return chars.trim().isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + getSpan().hashCode();
		result = prime * result + chars.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		CharsNode other = (CharsNode) obj;
		return getSpan().equals(other.getSpan()) && chars.equals(other.chars);
	}
}
