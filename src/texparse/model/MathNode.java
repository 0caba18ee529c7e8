package texparse.model;

import texparse.lexer.DelimiterPair;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

/**
 * A math region opened and closed by math-mode delimiters. Math environments are
 * {@link EnvironmentNode}s instead.
 */
public class MathNode extends LatexNode {
	private final MathDisplayType displayType;
	private final DelimiterPair delimiters;
	private final LatexNodeList nodes;
	private final boolean incomplete;

	public MathNode(SourceSpan span, ParsingState parsingState, MathDisplayType displayType,
	                DelimiterPair delimiters, LatexNodeList nodes, boolean incomplete) {
		super(span, parsingState);
		this.displayType = displayType;
		this.delimiters = delimiters;
		this.nodes = nodes;
		this.incomplete = incomplete;
	}

	public MathDisplayType getDisplayType() {
		return displayType;
	}

	public DelimiterPair getDelimiters() {
		return delimiters;
	}

	public LatexNodeList getNodes() {
		return nodes;
	}

	public boolean isIncomplete() {
		return incomplete;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), displayType, delimiters, nodes, incomplete);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		MathNode other = (MathNode) obj;
		return getSpan().equals(other.getSpan()) && displayType == other.displayType &&
				delimiters.equals(other.delimiters) && nodes.equals(other.nodes) && incomplete == other.incomplete;
	}
}
