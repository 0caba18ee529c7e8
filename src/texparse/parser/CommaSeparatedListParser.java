package texparse.parser;

import texparse.errors.LatexParseException;
import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.lexer.TokenType;
import texparse.model.CharsNode;
import texparse.model.GroupNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a group holding a comma-separated list, such as the keys of {@code \cite{a,b}}. The
 * resulting group node holds one group node per item; an item followed by a comma has the
 * delimiters {@code ("", ",")}, the last one {@code ("", "")}. Commas nested in groups do not
 * separate items.
 */
public class CommaSeparatedListParser extends DelimitedGroupParser {
	private final boolean keepEmptyParts;

	public CommaSeparatedListParser() {
		this(new DelimiterPair("{", "}"), false, false);
	}

	public CommaSeparatedListParser(DelimiterPair delimiters, boolean optional, boolean keepEmptyParts) {
		super(delimiters, optional, true);
		this.keepEmptyParts = keepEmptyParts;
	}

	@Override
	protected ParsingState getContentsParsingState(ParsingState groupState, Token opener, LatexWalker walker) {
		return groupState.toBuilder()
				.setEnableMacros(false)
				.setEnableSpecials(false)
				.setEnableMath(false)
				.build();
	}

	@Override
	protected LatexParser<LatexNodeList> makeContentsParser(Token opener, String closingDelimiter) {
		return new ItemsParser(closingDelimiter);
	}

	private static boolean isComma(Token token) {
		return token.getType() == TokenType.CHARS && token.getValue().equals(",");
	}

	private class ItemsParser implements LatexParser<LatexNodeList> {
		private final String closingDelimiter;

		ItemsParser(String closingDelimiter) {
			this.closingDelimiter = closingDelimiter;
		}

		@Override
		public ParseResult<LatexNodeList> parse(LatexWalker walker, TokenReader reader, ParsingState state)
				throws LatexParseException {
			int listStart = reader.getPosition();
			List<LatexNode> items = new ArrayList<>();
			GeneralNodesParser itemParser = new GeneralNodesParser(
					t -> isComma(t) || isClosingToken(t, closingDelimiter), null, true,
					"Unexpected end of stream while looking for closing ‘" + closingDelimiter + "’");
			while (true) {
				int itemStart = reader.getPosition();
				ParseResult.Success<LatexNodeList> item = walker.parseContent(itemParser, reader, state, null);
				Token stop = item.getCarryover().getStopToken();
				if (stop == null) {
					addItem(items, item.getValue(), new SourceSpan(itemStart, reader.getPosition()), state, "");
					return ParseResult.success(LatexNodeList.of(items, listStart, state),
							CarryoverInfo.empty().withEndOfStream());
				}
				if (isComma(stop)) {
					addItem(items, item.getValue(), new SourceSpan(itemStart, stop.getEnd()), state, ",");
					continue;
				}
				addItem(items, item.getValue(), new SourceSpan(itemStart, stop.getStart()), state, "");
				return ParseResult.success(LatexNodeList.of(items, listStart, state),
						CarryoverInfo.empty().withStopToken(stop, true));
			}
		}

		private void addItem(List<LatexNode> items, LatexNodeList nodes, SourceSpan span, ParsingState state,
		                     String separator) {
			if (!keepEmptyParts && isBlank(nodes)) {
				return;
			}
			items.add(new GroupNode(span, state, new DelimiterPair("", separator), nodes, false));
		}

		private boolean isBlank(LatexNodeList nodes) {
			for (LatexNode node : nodes) {
				if (!(node instanceof CharsNode) || !((CharsNode) node).isWhitespace()) {
					return false;
				}
			}
			return true;
		}
	}
}
