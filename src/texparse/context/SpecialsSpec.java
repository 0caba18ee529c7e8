package texparse.context;

import texparse.lexer.Token;
import texparse.model.LatexNode;
import texparse.parser.CarryoverInfo;
import texparse.parser.LatexParser;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * A character sequence with a meaning of its own, such as {@code ~} or {@code --}.
 */
public class SpecialsSpec extends CallableSpec {
	private final String specialsChars;

	public SpecialsSpec(String specialsChars) {
		this(specialsChars, Collections.emptyList());
	}

	public SpecialsSpec(String specialsChars, List<ArgumentSpec> arguments) {
		this(specialsChars, arguments, null, null);
	}

	public SpecialsSpec(String specialsChars, List<ArgumentSpec> arguments,
	                    Function<Token, LatexParser<? extends LatexNode>> parserOverride,
	                    Function<LatexNode, CarryoverInfo> carryoverHook) {
		super(arguments, parserOverride, carryoverHook);
		if (specialsChars.isEmpty()) {
			throw new IllegalArgumentException("specials must have at least one character");
		}
		this.specialsChars = specialsChars;
	}

	public String getSpecialsChars() {
		return specialsChars;
	}

	@Override
	protected LatexParser<? extends LatexNode> makeDefaultNodeParser(Token token) {
		return new SpecialsCallParser(token, this);
	}

	@Override
	public String toString() {
		return "SpecialsSpec [chars=" + specialsChars + ", arguments=" + getArguments() + "]";
	}
}
