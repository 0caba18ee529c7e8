package texparse.lexer;

import texparse.errors.EndOfStreamException;
import texparse.state.ParsingState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Replays a fixed list of already-read tokens. Positions are source offsets, so parsers can mix
 * this reader with recovery logic written against {@link LatexTokenReader}. The parsing state
 * has no influence on which token is returned.
 */
public class TokenListTokenReader extends TokenReader {
	private final List<Token> tokens;
	private int index = 0;

	public TokenListTokenReader(List<Token> tokens) {
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
	}

	@Override
	public Token peekToken(ParsingState state) throws EndOfStreamException {
		if (index >= tokens.size()) {
			throw new EndOfStreamException("");
		}
		return tokens.get(index);
	}

	@Override
	public int getPosition() {
		if (index < tokens.size()) {
			return tokens.get(index).getStartIncludingPreSpace();
		}
		return tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getEnd();
	}

	@Override
	public void moveToPosition(int position) {
		int i = 0;
		while (i < tokens.size() && tokens.get(i).getStartIncludingPreSpace() < position) {
			i++;
		}
		index = i;
	}

	@Override
	public void moveToToken(Token token, boolean rewindPreSpace) {
		index = indexOf(token);
	}

	@Override
	public void movePastToken(Token token, boolean fastForwardPostSpace) {
		index = indexOf(token) + 1;
	}

	private int indexOf(Token token) {
		int i = tokens.indexOf(token);
		if (i == -1) {
			throw new IllegalArgumentException("token " + token + " is not part of this reader's token list");
		}
		return i;
	}
}
