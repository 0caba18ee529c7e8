package texparse.model;

import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

/**
 * Marks input that could not be parsed and was skipped during tolerant parsing. The span covers
 * exactly the skipped input.
 */
public class ErrorNode extends LatexNode {
	private final String message;

	public ErrorNode(SourceSpan span, ParsingState parsingState, String message) {
		super(span, parsingState);
		this.message = message;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), message);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ErrorNode other = (ErrorNode) obj;
		return getSpan().equals(other.getSpan()) && message.equals(other.message);
	}
}
