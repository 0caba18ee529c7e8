package texparse.parser;

import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.lexer.TokenType;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.model.MathDisplayType;
import texparse.model.MathNode;
import texparse.state.EnterMathMode;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

/**
 * Parses a math region delimited by e.g. {@code $...$} or {@code \[...\]}.
 */
public class MathParser extends DelimitedExpressionParser {
	private final String openingDelimiter;

	/**
	 * Accepts any math delimiter.
	 */
	public MathParser() {
		this(null);
	}

	public MathParser(String openingDelimiter) {
		super(false, true);
		this.openingDelimiter = openingDelimiter;
	}

	@Override
	protected boolean isAcceptableOpener(Token token, ParsingState groupState) {
		return token.getType().isMathDelimiter()
				&& groupState.findMathDelimiterPair(token.getValue()) != null
				&& (openingDelimiter == null || openingDelimiter.equals(token.getValue()));
	}

	@Override
	protected String getClosingDelimiter(Token opener, ParsingState groupState) {
		return groupState.findMathDelimiterPair(opener.getValue()).getClose();
	}

	@Override
	protected String describeExpectedOpener(ParsingState groupState) {
		return openingDelimiter != null ? "‘" + openingDelimiter + "’" : "a math mode delimiter";
	}

	@Override
	protected ParsingState getContentsParsingState(ParsingState groupState, Token opener, LatexWalker walker) {
		return new EnterMathMode(opener.getValue(), opener).apply(groupState, walker);
	}

	@Override
	protected boolean isClosingToken(Token token, String closingDelimiter) {
		return token.getType().isMathDelimiter() && token.getValue().equals(closingDelimiter);
	}

	@Override
	protected LatexNode makeNode(SourceSpan span, ParsingState state, Token opener, String closingDelimiter,
	                             LatexNodeList contents, boolean incomplete) {
		MathDisplayType displayType = opener.getType() == TokenType.MATH_DISPLAY ? MathDisplayType.DISPLAY
				: MathDisplayType.INLINE;
		return new MathNode(span, state, displayType, new DelimiterPair(opener.getValue(), closingDelimiter),
				contents, incomplete);
	}
}
