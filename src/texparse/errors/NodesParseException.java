package texparse.errors;

import texparse.state.ParsingState;

/**
 * A structural error: a missing opening delimiter, an unclosed construct, a stray closing token.
 */
@SuppressWarnings("serial")
public class NodesParseException extends LatexParseException {

	public NodesParseException(String message, int position, ParsingState parsingState) {
		super(message, position, parsingState);
	}

	public NodesParseException(String message, int position, ParsingState parsingState, Throwable cause) {
		super(message, position, parsingState, cause);
	}
}
