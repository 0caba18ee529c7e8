package texparse.model;

import texparse.context.SpecialsSpec;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

public class SpecialsNode extends LatexNode {
	private final String specialsChars;
	private final SpecialsSpec spec;
	private final ParsedArguments arguments;

	public SpecialsNode(SourceSpan span, ParsingState parsingState, String specialsChars, SpecialsSpec spec,
	                    ParsedArguments arguments) {
		super(span, parsingState);
		this.specialsChars = specialsChars;
		this.spec = spec;
		this.arguments = arguments;
	}

	public String getSpecialsChars() {
		return specialsChars;
	}

	public SpecialsSpec getSpec() {
		return spec;
	}

	public ParsedArguments getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), specialsChars, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		SpecialsNode other = (SpecialsNode) obj;
		return getSpan().equals(other.getSpan()) && specialsChars.equals(other.specialsChars) &&
				spec == other.spec && arguments.equals(other.arguments);
	}
}
