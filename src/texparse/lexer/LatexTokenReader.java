package texparse.lexer;

import texparse.context.LatexContextDb;
import texparse.context.SpecialsSpec;
import texparse.errors.EndOfStreamException;
import texparse.errors.TokenParseException;
import texparse.parser.Recovery;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads tokens directly from a source string.
 *
 * <p>At each position, after skipping whitespace, the reader tries in order: a paragraph break,
 * math-mode delimiters (the expected closing delimiter first, then every delimiter longest
 * first), {@code \begin}/{@code \end}, macros, comments, group delimiters, specials (longest
 * match) and finally plain characters. Letters and digits are read as a maximal run; any other
 * plain character is a token on its own.</p>
 */
public class LatexTokenReader extends TokenReader {

	private static final Logger logger = Logger.getLogger("TeXParse Token Reader");

	private static final Pattern ENVIRONMENT_NAME = Pattern.compile("\\s*\\{([A-Za-z0-9*._ :/!^()\\[\\]-]+)\\}");

	private final String source;
	private int position;

	public LatexTokenReader(String source) {
		this(source, 0);
	}

	public LatexTokenReader(String source, int position) {
		if (position < 0 || position > source.length()) {
			throw new IllegalArgumentException("position " + position + " outside of source");
		}
		this.source = source;
		this.position = position;
	}

	public String getSource() {
		return source;
	}

	@Override
	public int getPosition() {
		return position;
	}

	@Override
	public void moveToPosition(int position) {
		if (position < 0 || position > source.length()) {
			throw new IllegalArgumentException("position " + position + " outside of source");
		}
		this.position = position;
	}

	@Override
	public String peekChars(int count) throws EndOfStreamException {
		if (position >= source.length()) {
			throw new EndOfStreamException("");
		}
		return source.substring(position, Integer.min(position + count, source.length()));
	}

	@Override
	public Token peekToken(ParsingState state) throws EndOfStreamException, TokenParseException {
		int spaceEnd = skipSpace(position);
		String preSpace = source.substring(position, spaceEnd);

		if (state.isEnableDoubleNewlineParagraphs() && countNewlines(preSpace) >= 2) {
			return readParagraph(preSpace, state);
		}

		if (spaceEnd >= source.length()) {
			throw new EndOfStreamException(preSpace);
		}

		int pos = spaceEnd;
		char c = source.charAt(pos);

		if (state.isEnableMath() && state.isMathDelimiterStart(c)) {
			Token math = readMathDelimiter(pos, preSpace, state);
			if (math != null) {
				return math;
			}
		}

		if (c == state.getMacroEscapeChar()) {
			if (state.isEnableEnvironments()) {
				String beginEnd = null;
				if (source.startsWith("begin", pos + 1)) {
					beginEnd = "begin";
				} else if (source.startsWith("end", pos + 1)) {
					beginEnd = "end";
				}
				if (beginEnd != null) {
					int afterKeyword = pos + 1 + beginEnd.length();
					if (afterKeyword >= source.length() || !state.isMacroAlphaChar(source.charAt(afterKeyword))) {
						return readEnvironment(pos, beginEnd, preSpace, state);
					}
				}
			}
			if (state.isEnableMacros()) {
				return readMacro(pos, preSpace, state);
			}
		}

		if (state.isEnableComments() && source.startsWith(state.getCommentStart(), pos)) {
			return readComment(pos, preSpace, state);
		}

		if (state.isEnableGroups()) {
			for (DelimiterPair pair : state.getGroupDelimiters()) {
				if (source.startsWith(pair.getOpen(), pos)) {
					return new Token(TokenType.GROUP_OPEN, pair.getOpen(), pos, pos + pair.getOpen().length(),
							preSpace);
				}
			}
			for (DelimiterPair pair : state.getGroupDelimiters()) {
				if (source.startsWith(pair.getClose(), pos)) {
					return new Token(TokenType.GROUP_CLOSE, pair.getClose(), pos, pos + pair.getClose().length(),
							preSpace);
				}
			}
		}

		if (state.isEnableSpecials() && state.getContextDb() != null) {
			SpecialsSpec spec = state.getContextDb().testForSpecials(source, pos);
			if (spec != null) {
				return Token.specials(spec, pos, pos + spec.getSpecialsChars().length(), preSpace);
			}
		}

		return readChars(pos, preSpace, state);
	}

	private int skipSpace(int from) {
		int p = from;
		while (p < source.length() && Character.isWhitespace(source.charAt(p))) {
			p++;
		}
		return p;
	}

	private static int countNewlines(String s) {
		int count = 0;
		for (int i = 0; i < s.length(); ++i) {
			if (s.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	// whitespace after a macro or comment stops before a paragraph break
	private String trimAtParagraphBreak(String space) {
		if (countNewlines(space) >= 2) {
			return space.substring(0, space.indexOf('\n'));
		}
		return space;
	}

	private Token readParagraph(String space, ParsingState state) {
		int relStart = space.indexOf('\n');
		int relEnd = space.lastIndexOf('\n') + 1;
		String preSpace = space.substring(0, relStart);
		int start = position + relStart;
		int end = position + relEnd;
		LatexContextDb db = state.getContextDb();
		if (db != null) {
			SpecialsSpec paragraph = db.findSpecialsSpec("\n\n");
			if (paragraph != null) {
				return Token.specials(paragraph, start, end, preSpace);
			}
		}
		return new Token(TokenType.CHARS, source.substring(start, end), start, end, preSpace);
	}

	private Token readMathDelimiter(int pos, String preSpace, ParsingState state) {
		ParsingState.MathDelimiter expected = state.getExpectedClosingMathDelimiter();
		if (expected != null && source.startsWith(expected.getDelimiter(), pos)) {
			return new Token(expected.getTokenType(), expected.getDelimiter(), pos,
					pos + expected.getDelimiter().length(), preSpace);
		}
		for (ParsingState.MathDelimiter delimiter : state.getMathDelimitersByLength()) {
			if (source.startsWith(delimiter.getDelimiter(), pos)) {
				return new Token(delimiter.getTokenType(), delimiter.getDelimiter(), pos,
						pos + delimiter.getDelimiter().length(), preSpace);
			}
		}
		return null;
	}

	private Token readEnvironment(int pos, String beginEnd, String preSpace, ParsingState state)
			throws TokenParseException {
		int nameStart = pos + 1 + beginEnd.length();
		Matcher matcher = ENVIRONMENT_NAME.matcher(source);
		matcher.region(nameStart, source.length());
		if (!matcher.lookingAt()) {
			String keyword = state.getMacroEscapeChar() + beginEnd;
			logger.finer("malformed \\" + beginEnd + " at " + pos);
			throw new TokenParseException("Bad ‘\\" + beginEnd + "’ call: expected {environmentname}", pos, state,
					new Token(TokenType.CHARS, keyword, pos, pos + keyword.length(), preSpace),
					Recovery.nextLine(pos));
		}
		TokenType type = beginEnd.equals("begin") ? TokenType.BEGIN_ENVIRONMENT : TokenType.END_ENVIRONMENT;
		return new Token(type, matcher.group(1), pos, matcher.end(), preSpace);
	}

	private Token readMacro(int pos, String preSpace, ParsingState state) throws TokenParseException {
		if (pos + 1 >= source.length()) {
			String escape = String.valueOf(state.getMacroEscapeChar());
			throw new TokenParseException("Expected macro name after ‘" + escape + "’ escape character", pos + 1,
					state, new Token(TokenType.CHARS, escape, pos, pos + 1, preSpace),
					Recovery.atPosition(source.length()));
		}
		char first = source.charAt(pos + 1);
		int nameEnd = pos + 2;
		String postSpace = "";
		if (state.isMacroAlphaChar(first)) {
			while (nameEnd < source.length() && state.isMacroAlphaChar(source.charAt(nameEnd))) {
				nameEnd++;
			}
			postSpace = trimAtParagraphBreak(source.substring(nameEnd, skipSpace(nameEnd)));
		}
		String name = source.substring(pos + 1, nameEnd);
		return new Token(TokenType.MACRO, name, new SourceSpan(pos, nameEnd + postSpace.length()), preSpace,
				postSpace, null);
	}

	private Token readComment(int pos, String preSpace, ParsingState state) {
		int textStart = pos + state.getCommentStart().length();
		int newline = source.indexOf('\n', textStart);
		if (newline == -1) {
			return new Token(TokenType.COMMENT, source.substring(textStart), new SourceSpan(pos, source.length()),
					preSpace, "", null);
		}
		String postSpace = trimAtParagraphBreak(source.substring(newline, skipSpace(newline)));
		return new Token(TokenType.COMMENT, source.substring(textStart, newline),
				new SourceSpan(pos, newline + postSpace.length()), preSpace, postSpace, null);
	}

	private Token readChars(int pos, String preSpace, ParsingState state) throws TokenParseException {
		char c = source.charAt(pos);
		if (state.isForbidden(c)) {
			throw new TokenParseException(String.format("Character is forbidden here: ‘%c’ (%#x)", c, (int) c),
					pos, state, new Token(TokenType.CHARS, String.valueOf(c), pos, pos + 1, preSpace),
					Recovery.atPosition(pos + 1));
		}
		int end = pos + 1;
		if (Character.isLetterOrDigit(c)) {
			while (end < source.length() && continuesRun(end, state)) {
				end++;
			}
		}
		return new Token(TokenType.CHARS, source.substring(pos, end), pos, end, preSpace);
	}

	private boolean continuesRun(int pos, ParsingState state) {
		char c = source.charAt(pos);
		if (!Character.isLetterOrDigit(c) || state.isForbidden(c)) {
			return false;
		}
		if (state.isEnableMath() && state.isMathDelimiterStart(c)) {
			return false;
		}
		if (state.isEnableSpecials() && state.getContextDb() != null
				&& state.getContextDb().testForSpecials(source, pos) != null) {
			return false;
		}
		return true;
	}
}
