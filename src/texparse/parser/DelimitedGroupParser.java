package texparse.parser;

import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.lexer.TokenType;
import texparse.model.GroupNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;

/**
 * Parses a group such as {@code {...}} or {@code [...]}. Delimiters that are not group
 * delimiters of the current parsing state, like the brackets of an optional argument, are
 * added to it while the group is read.
 */
public class DelimitedGroupParser extends DelimitedExpressionParser {
	private final DelimiterPair delimiters;

	/**
	 * Accepts any group delimiter of the current parsing state.
	 */
	public DelimitedGroupParser() {
		this(null);
	}

	public DelimitedGroupParser(DelimiterPair delimiters) {
		this(delimiters, false, true);
	}

	/**
	 * @param delimiters the only delimiters to accept, or null for any group delimiters
	 */
	public DelimitedGroupParser(DelimiterPair delimiters, boolean optional, boolean allowPreSpace) {
		super(optional, allowPreSpace);
		this.delimiters = delimiters;
	}

	public DelimiterPair getDelimiters() {
		return delimiters;
	}

	@Override
	protected ParsingState getGroupParsingState(ParsingState state) {
		if (delimiters == null || state.getGroupDelimiters().contains(delimiters)) {
			return state;
		}
		return state.toBuilder().addGroupDelimiter(delimiters).build();
	}

	@Override
	protected boolean isAcceptableOpener(Token token, ParsingState groupState) {
		if (token.getType() != TokenType.GROUP_OPEN) {
			return false;
		}
		return delimiters == null || delimiters.getOpen().equals(token.getValue());
	}

	@Override
	protected String getClosingDelimiter(Token opener, ParsingState groupState) {
		if (delimiters != null) {
			return delimiters.getClose();
		}
		return groupState.findGroupDelimiterPairByOpen(opener.getValue()).getClose();
	}

	@Override
	protected String describeExpectedOpener(ParsingState groupState) {
		if (delimiters != null) {
			return "‘" + delimiters.getOpen() + "’";
		}
		StringBuilder sb = new StringBuilder();
		for (DelimiterPair pair : groupState.getGroupDelimiters()) {
			sb.append(sb.length() == 0 ? "" : " or ").append("‘").append(pair.getOpen()).append("’");
		}
		return sb.length() == 0 ? "an opening delimiter" : sb.toString();
	}

	@Override
	protected LatexNode makeNode(SourceSpan span, ParsingState state, Token opener, String closingDelimiter,
	                             LatexNodeList contents, boolean incomplete) {
		return new GroupNode(span, state, new DelimiterPair(opener.getValue(), closingDelimiter), contents,
				incomplete);
	}
}
