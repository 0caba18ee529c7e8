package texparse.parser;

import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.TokenParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.lexer.TokenType;
import texparse.model.CharsNode;
import texparse.model.LatexNode;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

/**
 * Reads an optional marker such as the star of {@code \section*}. Yields null, without moving
 * the token reader, if the marker is absent.
 */
public class OptionalCharsMarkerParser implements LatexParser<LatexNode> {
	private final String marker;
	private final boolean allowPreSpace;

	public OptionalCharsMarkerParser(String marker) {
		this(marker, true);
	}

	public OptionalCharsMarkerParser(String marker, boolean allowPreSpace) {
		if (marker.isEmpty()) {
			throw new IllegalArgumentException("empty marker");
		}
		this.marker = marker;
		this.allowPreSpace = allowPreSpace;
	}

	public String getMarker() {
		return marker;
	}

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		Token token;
		try {
			token = reader.peekToken(state);
		} catch (EndOfStreamException | TokenParseException e) {
			return ParseResult.success(null);
		}
		if (!allowPreSpace && !token.getPreSpace().isEmpty()) {
			return ParseResult.success(null);
		}
		boolean matches;
		if (token.getType() == TokenType.CHARS) {
			matches = token.getValue().startsWith(marker);
		} else if (token.getType() == TokenType.SPECIALS) {
			matches = token.getValue().equals(marker);
		} else {
			matches = false;
		}
		if (!matches) {
			return ParseResult.success(null);
		}
		int end = token.getStart() + marker.length();
		reader.moveToPosition(end);
		return ParseResult.success(new CharsNode(new SourceSpan(token.getStart(), end), state, marker));
	}
}
