package texparse.model;

import texparse.lexer.DelimiterPair;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

/**
 * A delimited group, usually {@code {...}}. Optional arguments, comma-separated list items and
 * verbatim arguments are also represented as groups with the appropriate delimiters.
 */
public class GroupNode extends LatexNode {
	private final DelimiterPair delimiters;
	private final LatexNodeList nodes;
	private final boolean incomplete;

	public GroupNode(SourceSpan span, ParsingState parsingState, DelimiterPair delimiters, LatexNodeList nodes,
	                 boolean incomplete) {
		super(span, parsingState);
		this.delimiters = delimiters;
		this.nodes = nodes;
		this.incomplete = incomplete;
	}

	public DelimiterPair getDelimiters() {
		return delimiters;
	}

	public LatexNodeList getNodes() {
		return nodes;
	}

	/**
	 * @return true if the input ended before the closing delimiter (tolerant parsing only)
	 */
	public boolean isIncomplete() {
		return incomplete;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), delimiters, nodes, incomplete);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GroupNode other = (GroupNode) obj;
		return getSpan().equals(other.getSpan()) && delimiters.equals(other.delimiters) &&
				nodes.equals(other.nodes) && incomplete == other.incomplete;
	}
}
