package texparse.context;

import texparse.errors.LatexParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.model.LatexNode;
import texparse.model.MacroNode;
import texparse.model.ParsedArguments;
import texparse.parser.ParseResult;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

public class MacroCallParser extends CallParser<MacroSpec> {

	public MacroCallParser(Token token, MacroSpec spec) {
		super(token, spec);
	}

	@Override
	protected String describeCall() {
		return "macro ‘\\" + token.getValue() + "’";
	}

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		ParsedArguments arguments = parseArguments(walker, reader, state);
		MacroNode node = new MacroNode(new SourceSpan(token.getStart(), endOf(arguments)), state, token.getValue(),
				spec, arguments, token.getPostSpace());
		return ParseResult.success(node, spec.makeCarryoverInfo(node));
	}
}
