package texparse.model;

import texparse.context.EnvironmentSpec;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

/**
 * A {@code \begin{name}...\end{name}} region. The span covers both markers.
 */
public class EnvironmentNode extends LatexNode {
	private final String name;
	private final EnvironmentSpec spec;
	private final ParsedArguments arguments;
	private final LatexNodeList body;
	private final boolean incomplete;

	public EnvironmentNode(SourceSpan span, ParsingState parsingState, String name, EnvironmentSpec spec,
	                       ParsedArguments arguments, LatexNodeList body, boolean incomplete) {
		super(span, parsingState);
		this.name = name;
		this.spec = spec;
		this.arguments = arguments;
		this.body = body;
		this.incomplete = incomplete;
	}

	public String getName() {
		return name;
	}

	public EnvironmentSpec getSpec() {
		return spec;
	}

	public ParsedArguments getArguments() {
		return arguments;
	}

	public LatexNodeList getBody() {
		return body;
	}

	/**
	 * @return true if the input ended before {@code \end{name}} (tolerant parsing only)
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
		return Objects.hash(getSpan(), name, arguments, body, incomplete);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		EnvironmentNode other = (EnvironmentNode) obj;
		return getSpan().equals(other.getSpan()) && name.equals(other.name) && spec == other.spec &&
				arguments.equals(other.arguments) && body.equals(other.body) && incomplete == other.incomplete;
	}
}
