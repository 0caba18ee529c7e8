package texparse.parser;

import texparse.context.MacroSpec;
import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.errors.OpenContext;
import texparse.errors.TokenParseException;
import texparse.errors.UnknownConstructException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.model.CharsNode;
import texparse.model.LatexNode;
import texparse.model.MacroNode;
import texparse.model.ParsedArguments;
import texparse.model.SpecialsNode;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

/**
 * Reads a single TeX expression, the way a mandatory macro argument is read: a group, a macro,
 * a specials sequence, a math region or a single character. Only the first character of a run
 * of characters is taken, so that {@code \frac12} has the arguments {@code 1} and {@code 2}.
 */
public class ExpressionParser implements LatexParser<LatexNode> {

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		Token token;
		try {
			token = reader.peekToken(state);
		} catch (EndOfStreamException e) {
			return ParseResult.failure(new NodesParseException("Expected an expression, reached end of stream",
					reader.getPosition(), state), null, CarryoverInfo.empty(), Recovery.atPosition(reader.getPosition()));
		} catch (TokenParseException e) {
			return ParseResult.failure(e, null, CarryoverInfo.empty(), Recovery.atToken(e.getRecoveryToken()));
		}

		switch (token.getType()) {
			case CHARS: {
				int end = token.getStart() + Character.charCount(token.getValue().codePointAt(0));
				reader.moveToPosition(end);
				return ParseResult.success(new CharsNode(new SourceSpan(token.getStart(), end), state,
						state.getSource().substring(token.getStart(), end)));
			}
			case GROUP_OPEN:
				return ParseResult.widen(walker.parseContent(new DelimitedGroupParser(), reader, state, null));
			case MACRO:
				return readMacro(walker, reader, state, token);
			case SPECIALS:
				reader.movePastToken(token);
				return ParseResult.success(new SpecialsNode(token.getSpan(), state, token.getValue(),
						token.getSpecialsSpec(), ParsedArguments.empty(token.getEnd())));
			case MATH_INLINE:
			case MATH_DISPLAY:
				if (!state.isInMathMode() && state.findMathDelimiterPair(token.getValue()) != null) {
					return ParseResult.widen(walker.parseContent(new MathParser(token.getValue()), reader, state,
							null));
				}
				break;
			default:
				break;
		}
		return ParseResult.failure(new NodesParseException("Expected an expression, got ‘" + token.getValue() + "’",
				token.getStart(), state), null, CarryoverInfo.empty(), Recovery.atToken(token));
	}

	private ParseResult<LatexNode> readMacro(LatexWalker walker, TokenReader reader, ParsingState state, Token token)
			throws LatexParseException {
		reader.movePastToken(token);
		if (walker.getOptions().isMacroArgumentsInExpressions()) {
			MacroSpec spec;
			try {
				spec = state.getContextDb().getMacroSpec(token.getValue());
			} catch (UnknownConstructException e) {
				return ParseResult.failure(new NodesParseException("Encountered " + e.getMessage(), token.getStart(),
						state, e), null, CarryoverInfo.empty(), Recovery.pastToken(token));
			}
			return ParseResult.widen(walker.parseContent(spec.getNodeParser(token), reader, state,
					new OpenContext("macro ‘\\" + token.getValue() + "’", token.getSpan())));
		}
		MacroSpec spec = state.getContextDb().findMacroSpec(token.getValue());
		if (spec == null) {
			spec = state.getContextDb().getUnknownMacroSpec();
		}
		if (spec == null) {
			spec = new MacroSpec(token.getValue());
		}
		return ParseResult.success(new MacroNode(token.getSpan(), state, token.getValue(), spec,
				ParsedArguments.empty(token.getEnd()), token.getPostSpace()));
	}
}
