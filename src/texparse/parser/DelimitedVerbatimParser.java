package texparse.parser;

import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.lexer.DelimiterPair;
import texparse.lexer.TokenReader;
import texparse.model.CharsNode;
import texparse.model.GroupNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

import java.util.Collections;
import java.util.List;

/**
 * Reads raw characters between delimiters, as in {@code \verb|x^2|}. Without fixed delimiters,
 * the character right at the reader's position opens the verbatim text; brackets close with
 * their counterpart and nest, any other character closes itself.
 */
public class DelimitedVerbatimParser implements LatexParser<LatexNode> {
	private static final String AUTO_OPEN = "{[<(";
	private static final String AUTO_CLOSE = "}]>)";

	private final DelimiterPair delimiters;

	public DelimitedVerbatimParser() {
		this(null);
	}

	public DelimitedVerbatimParser(DelimiterPair delimiters) {
		this.delimiters = delimiters;
	}

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		int start = reader.getPosition();
		String open;
		try {
			open = reader.peekChars(1);
		} catch (EndOfStreamException e) {
			return ParseResult.failure(new NodesParseException("Expected verbatim delimiter, reached end of stream",
					start, state), null, CarryoverInfo.empty(), Recovery.atPosition(start));
		}
		String close;
		if (delimiters != null) {
			if (!delimiters.getOpen().equals(open)) {
				return ParseResult.failure(new NodesParseException("Expected ‘" + delimiters.getOpen() +
						"’ to open verbatim text, got ‘" + open + "’", start, state), null, CarryoverInfo.empty(),
						Recovery.atPosition(start));
			}
			close = delimiters.getClose();
		} else {
			int auto = AUTO_OPEN.indexOf(open);
			close = auto == -1 ? open : String.valueOf(AUTO_CLOSE.charAt(auto));
		}

		String source = state.getSource();
		int contentStart = start + open.length();
		int closeAt = findClose(source, contentStart, open, close);
		if (closeAt == -1) {
			GroupNode partial = makeNode(state, start, source.length(), open, close, contentStart, source.length(),
					true);
			return ParseResult.failure(new NodesParseException("Unterminated verbatim text, expected ‘" + close + "’",
					source.length(), state), partial, CarryoverInfo.empty().withEndOfStream(),
					Recovery.atPosition(source.length()));
		}
		int end = closeAt + close.length();
		reader.moveToPosition(end);
		return ParseResult.success(makeNode(state, start, end, open, close, contentStart, closeAt, false));
	}

	private static int findClose(String source, int from, String open, String close) {
		int depth = 0;
		for (int p = from; p < source.length(); ++p) {
			if (!open.equals(close) && source.startsWith(open, p)) {
				depth++;
			} else if (source.startsWith(close, p)) {
				if (depth == 0) {
					return p;
				}
				depth--;
			}
		}
		return -1;
	}

	private static GroupNode makeNode(ParsingState state, int start, int end, String open, String close,
	                                  int contentStart, int contentEnd, boolean incomplete) {
		List<LatexNode> content = Collections.emptyList();
		if (contentEnd > contentStart) {
			content = Collections.singletonList(new CharsNode(new SourceSpan(contentStart, contentEnd), state,
					state.getSource().substring(contentStart, contentEnd)));
		}
		return new GroupNode(new SourceSpan(start, end), state, new DelimiterPair(open, close),
				LatexNodeList.of(content, contentStart, state), incomplete);
	}
}
