package texparse.parser;

import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.state.ParsingState;

/**
 * Where a token reader should continue after a failed parse.
 */
public final class Recovery {

	public enum Kind {
		// leave the offending token to be read again by the caller
		AT_TOKEN,
		PAST_TOKEN,
		AT_POSITION,
		NEXT_LINE,
		NEXT_DELIMITER
	}

	private final Kind kind;
	private final Token token;
	private final int position;

	private Recovery(Kind kind, Token token, int position) {
		this.kind = kind;
		this.token = token;
		this.position = position;
	}

	public static Recovery atToken(Token token) {
		return new Recovery(Kind.AT_TOKEN, token, token.getStartIncludingPreSpace());
	}

	public static Recovery pastToken(Token token) {
		return new Recovery(Kind.PAST_TOKEN, token, token.getEnd());
	}

	public static Recovery atPosition(int position) {
		return new Recovery(Kind.AT_POSITION, null, position);
	}

	public static Recovery nextLine(int from) {
		return new Recovery(Kind.NEXT_LINE, null, from);
	}

	public static Recovery nextDelimiter(int from) {
		return new Recovery(Kind.NEXT_DELIMITER, null, from);
	}

	public Kind getKind() {
		return kind;
	}

	public Token getToken() {
		return token;
	}

	public int getPosition() {
		return position;
	}

	/**
	 * Moves the reader to where parsing should continue.
	 */
	public void apply(TokenReader reader, ParsingState state) {
		switch (kind) {
			case AT_TOKEN:
				reader.moveToToken(token);
				break;
			case PAST_TOKEN:
				reader.movePastToken(token);
				break;
			case AT_POSITION:
				reader.moveToPosition(position);
				break;
			case NEXT_LINE:
				reader.moveToPosition(findNextLine(state.getSource(), position));
				break;
			case NEXT_DELIMITER:
				reader.moveToPosition(findNextDelimiter(state, position));
				break;
		}
	}

	static int findNextLine(String source, int from) {
		int newline = source.indexOf('\n', from);
		return newline == -1 ? source.length() : newline + 1;
	}

	static int findNextDelimiter(ParsingState state, int from) {
		String source = state.getSource();
		for (int p = from; p < source.length(); ++p) {
			char c = source.charAt(p);
			if (c == state.getMacroEscapeChar() || source.startsWith(state.getCommentStart(), p)) {
				return p;
			}
			for (DelimiterPair pair : state.getGroupDelimiters()) {
				if (source.startsWith(pair.getOpen(), p) || source.startsWith(pair.getClose(), p)) {
					return p;
				}
			}
		}
		return source.length();
	}

	@Override
	public String toString() {
		return "Recovery [kind=" + kind + ", position=" + position + "]";
	}
}
