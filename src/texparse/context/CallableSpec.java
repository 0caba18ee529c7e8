package texparse.context;

import texparse.lexer.Token;
import texparse.model.LatexNode;
import texparse.parser.CarryoverInfo;
import texparse.parser.LatexParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * What macro, environment and specials specs have in common: a list of arguments, a parser for
 * the whole call, and an optional hook deciding how the call affects the parsing state of what
 * follows it.
 */
public abstract class CallableSpec {
	private final List<ArgumentSpec> arguments;
	private final Function<Token, LatexParser<? extends LatexNode>> parserOverride;
	private final Function<LatexNode, CarryoverInfo> carryoverHook;

	protected CallableSpec(List<ArgumentSpec> arguments,
	                       Function<Token, LatexParser<? extends LatexNode>> parserOverride,
	                       Function<LatexNode, CarryoverInfo> carryoverHook) {
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		this.parserOverride = parserOverride;
		this.carryoverHook = carryoverHook;
	}

	public List<ArgumentSpec> getArguments() {
		return arguments;
	}

	/**
	 * @param token the token that started the call; the token reader is positioned right after it
	 */
	public LatexParser<? extends LatexNode> getNodeParser(Token token) {
		if (parserOverride != null) {
			return parserOverride.apply(token);
		}
		return makeDefaultNodeParser(token);
	}

	protected abstract LatexParser<? extends LatexNode> makeDefaultNodeParser(Token token);

	public CarryoverInfo makeCarryoverInfo(LatexNode node) {
		if (carryoverHook == null) {
			return CarryoverInfo.empty();
		}
		CarryoverInfo info = carryoverHook.apply(node);
		return info == null ? CarryoverInfo.empty() : info;
	}
}
