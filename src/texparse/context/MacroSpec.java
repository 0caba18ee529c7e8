package texparse.context;

import texparse.lexer.Token;
import texparse.model.LatexNode;
import texparse.parser.CarryoverInfo;
import texparse.parser.LatexParser;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class MacroSpec extends CallableSpec {
	private final String name;

	public MacroSpec(String name) {
		this(name, Collections.emptyList());
	}

	public MacroSpec(String name, String argumentShorthand) {
		this(name, ArgumentSpec.parseShorthand(argumentShorthand));
	}

	public MacroSpec(String name, List<ArgumentSpec> arguments) {
		this(name, arguments, null, null);
	}

	public MacroSpec(String name, List<ArgumentSpec> arguments,
	                 Function<Token, LatexParser<? extends LatexNode>> parserOverride,
	                 Function<LatexNode, CarryoverInfo> carryoverHook) {
		super(arguments, parserOverride, carryoverHook);
		this.name = name;
	}

	/**
	 * @return the macro name, without the escape character
	 */
	public String getName() {
		return name;
	}

	@Override
	protected LatexParser<? extends LatexNode> makeDefaultNodeParser(Token token) {
		return new MacroCallParser(token, this);
	}

	@Override
	public String toString() {
		return "MacroSpec [name=" + name + ", arguments=" + getArguments() + "]";
	}
}
