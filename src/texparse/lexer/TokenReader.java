package texparse.lexer;

import texparse.errors.EndOfStreamException;
import texparse.errors.TokenParseException;
import texparse.state.ParsingState;

/**
 * A cursor over some LaTeX input that reads {@link Token}s according to a {@link ParsingState}.
 *
 * <p>Peeking never moves the cursor. Readers backed by raw text additionally offer
 * character-level access, which verbatim constructs use to bypass tokenization.</p>
 */
public abstract class TokenReader {

	public abstract Token peekToken(ParsingState state) throws EndOfStreamException, TokenParseException;

	public Token nextToken(ParsingState state) throws EndOfStreamException, TokenParseException {
		Token token = peekToken(state);
		movePastToken(token);
		return token;
	}

	public abstract int getPosition();

	public abstract void moveToPosition(int position);

	public void moveToToken(Token token) {
		moveToToken(token, true);
	}

	public void moveToToken(Token token, boolean rewindPreSpace) {
		moveToPosition(rewindPreSpace ? token.getStartIncludingPreSpace() : token.getStart());
	}

	public void movePastToken(Token token) {
		movePastToken(token, true);
	}

	public void movePastToken(Token token, boolean fastForwardPostSpace) {
		moveToPosition(fastForwardPostSpace ? token.getEnd() : token.getEnd() - token.getPostSpace().length());
	}

	/**
	 * @return up to {@code count} characters at the cursor, without moving it
	 * @throws EndOfStreamException if no characters remain
	 */
	public String peekChars(int count) throws EndOfStreamException {
		throw new UnsupportedOperationException(getClass().getSimpleName() + " does not provide character access");
	}

	public String nextChars(int count) throws EndOfStreamException {
		String chars = peekChars(count);
		moveToPosition(getPosition() + chars.length());
		return chars;
	}
}
