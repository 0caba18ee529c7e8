package texparse.parser;

import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.lexer.TokenReader;
import texparse.model.CharsNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

import java.util.Collections;
import java.util.List;

/**
 * Reads raw characters up to, not including, a terminator such as {@code \end{verbatim}}.
 */
public class TerminatedVerbatimParser implements LatexParser<LatexNodeList> {
	private final String terminator;

	public TerminatedVerbatimParser(String terminator) {
		this.terminator = terminator;
	}

	public String getTerminator() {
		return terminator;
	}

	@Override
	public ParseResult<LatexNodeList> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		String source = state.getSource();
		int start = reader.getPosition();
		int found = source.indexOf(terminator, start);
		if (found == -1) {
			reader.moveToPosition(source.length());
			return ParseResult.failure(new NodesParseException("Unexpected end of stream, expected ‘" + terminator +
							"’", source.length(), state), makeList(state, start, source.length()),
					CarryoverInfo.empty().withEndOfStream(), Recovery.atPosition(source.length()));
		}
		reader.moveToPosition(found);
		return ParseResult.success(makeList(state, start, found));
	}

	private static LatexNodeList makeList(ParsingState state, int start, int end) {
		List<LatexNode> content = Collections.emptyList();
		if (end > start) {
			content = Collections.singletonList(new CharsNode(new SourceSpan(start, end), state,
					state.getSource().substring(start, end)));
		}
		return LatexNodeList.of(content, start, state);
	}
}
