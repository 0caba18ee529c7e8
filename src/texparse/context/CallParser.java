package texparse.context;

import texparse.errors.LatexParseException;
import texparse.errors.OpenContext;
import texparse.lexer.Token;
import texparse.model.LatexNode;
import texparse.model.ParsedArguments;
import texparse.parser.ArgumentsParser;
import texparse.parser.LatexParser;
import texparse.parser.ParseResult;
import texparse.lexer.TokenReader;
import texparse.state.ParsingState;
import texparse.walker.LatexWalker;

/**
 * Base for the parsers of macro, environment and specials calls. The token reader is positioned
 * right after the token that started the call.
 */
abstract class CallParser<S extends CallableSpec> implements LatexParser<LatexNode> {
	protected final Token token;
	protected final S spec;

	CallParser(Token token, S spec) {
		this.token = token;
		this.spec = spec;
	}

	protected abstract String describeCall();

	protected ParsedArguments parseArguments(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		if (spec.getArguments().isEmpty()) {
			return ParsedArguments.empty(reader.getPosition());
		}
		ParseResult.Success<ParsedArguments> result = walker.parseContent(new ArgumentsParser(spec.getArguments()),
				reader, state, new OpenContext("arguments of " + describeCall(), token.getSpan()));
		return result.getValue();
	}

	protected int endOf(ParsedArguments arguments) {
		return Integer.max(token.getEnd(), arguments.getSpan().getEnd());
	}
}
