package texparse.parser;

import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.errors.TokenParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.lexer.TokenType;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

/**
 * Parses an opening delimiter, contents up to the matching closing delimiter, and the closing
 * delimiter. Subclasses decide which openers are acceptable, what closes them, in which
 * parsing state the contents are read and which node represents the result.
 *
 * <p>An optional expression whose opener is missing yields a null value and leaves the token
 * reader where it was. A required one fails, leaving the unexpected token to the caller.</p>
 */
public abstract class DelimitedExpressionParser implements LatexParser<LatexNode> {
	protected final boolean optional;
	protected final boolean allowPreSpace;

	protected DelimitedExpressionParser(boolean optional, boolean allowPreSpace) {
		this.optional = optional;
		this.allowPreSpace = allowPreSpace;
	}

	/**
	 * @return the state in which the opening delimiter is read
	 */
	protected ParsingState getGroupParsingState(ParsingState state) {
		return state;
	}

	protected abstract boolean isAcceptableOpener(Token token, ParsingState groupState);

	protected abstract String getClosingDelimiter(Token opener, ParsingState groupState);

	protected abstract String describeExpectedOpener(ParsingState groupState);

	protected ParsingState getContentsParsingState(ParsingState groupState, Token opener, LatexWalker walker) {
		return groupState;
	}

	protected boolean isClosingToken(Token token, String closingDelimiter) {
		return token.getType() == TokenType.GROUP_CLOSE && token.getValue().equals(closingDelimiter);
	}

	protected LatexParser<LatexNodeList> makeContentsParser(Token opener, String closingDelimiter) {
		return new GeneralNodesParser(t -> isClosingToken(t, closingDelimiter), null, true,
				"Unexpected end of stream while looking for closing ‘" + closingDelimiter + "’");
	}

	protected abstract LatexNode makeNode(SourceSpan span, ParsingState state, Token opener, String closingDelimiter,
	                                      LatexNodeList contents, boolean incomplete);

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		ParsingState groupState = getGroupParsingState(state);
		Token opener;
		try {
			opener = reader.peekToken(groupState);
		} catch (EndOfStreamException e) {
			if (optional) {
				return ParseResult.success(null);
			}
			return ParseResult.failure(new NodesParseException("Expected " + describeExpectedOpener(groupState) +
							", reached end of stream", reader.getPosition(), state), null, CarryoverInfo.empty(),
					Recovery.atPosition(reader.getPosition()));
		} catch (TokenParseException e) {
			opener = e.getRecoveryToken();
		}

		boolean acceptable = isAcceptableOpener(opener, groupState)
				&& (allowPreSpace || opener.getPreSpace().isEmpty());
		if (!acceptable) {
			if (optional) {
				return ParseResult.success(null);
			}
			return ParseResult.failure(new NodesParseException("Expected " + describeExpectedOpener(groupState) +
							", got ‘" + opener.getValue() + "’", opener.getStart(), state), null,
					CarryoverInfo.empty(), Recovery.atToken(opener));
		}
		reader.movePastToken(opener);

		String closingDelimiter = getClosingDelimiter(opener, groupState);
		ParsingState contentsState = getContentsParsingState(groupState, opener, walker);
		ParseResult.Success<LatexNodeList> contents = walker.parseContent(makeContentsParser(opener, closingDelimiter),
				reader, contentsState, null);

		Token closer = contents.getCarryover().getStopToken();
		boolean incomplete = closer == null && contents.getCarryover().isReachedEndOfStream();
		int end;
		if (closer != null) {
			end = closer.getEnd();
		} else {
			end = Integer.max(reader.getPosition(), contents.getValue().getSpan().getEnd());
		}
		return ParseResult.success(makeNode(new SourceSpan(opener.getStart(), end), state, opener, closingDelimiter,
				contents.getValue(), incomplete));
	}
}
