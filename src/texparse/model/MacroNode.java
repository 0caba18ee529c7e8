package texparse.model;

import texparse.context.MacroSpec;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

public class MacroNode extends LatexNode {
	private final String name;
	private final MacroSpec spec;
	private final ParsedArguments arguments;
	private final String postSpace;

	public MacroNode(SourceSpan span, ParsingState parsingState, String name, MacroSpec spec,
	                 ParsedArguments arguments, String postSpace) {
		super(span, parsingState);
		this.name = name;
		this.spec = spec;
		this.arguments = arguments;
		this.postSpace = postSpace;
	}

	public String getName() {
		return name;
	}

	public MacroSpec getSpec() {
		return spec;
	}

	public ParsedArguments getArguments() {
		return arguments;
	}

	/**
	 * @return the whitespace that immediately followed the macro name
	 */
	public String getPostSpace() {
		return postSpace;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), name, arguments, postSpace);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		MacroNode other = (MacroNode) obj;
		return getSpan().equals(other.getSpan()) && name.equals(other.name) && spec == other.spec &&
				arguments.equals(other.arguments) && postSpace.equals(other.postSpace);
	}
}
