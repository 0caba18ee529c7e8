package texparse.parser;

import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.state.ParsingState;
import texparse.walker.LatexWalker;

/**
 * Parses a group whose contents are plain characters, such as a label or a file name. Macros,
 * environments, specials, math and comments are not recognized inside; nested groups are.
 */
public class CharsGroupParser extends DelimitedGroupParser {

	public CharsGroupParser() {
		this(new DelimiterPair("{", "}"), false);
	}

	public CharsGroupParser(DelimiterPair delimiters, boolean optional) {
		super(delimiters, optional, true);
	}

	@Override
	protected ParsingState getContentsParsingState(ParsingState groupState, Token opener, LatexWalker walker) {
		return groupState.toBuilder()
				.setEnableMacros(false)
				.setEnableEnvironments(false)
				.setEnableSpecials(false)
				.setEnableMath(false)
				.setEnableComments(false)
				.build();
	}
}
