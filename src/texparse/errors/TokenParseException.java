package texparse.errors;

import texparse.lexer.Token;
import texparse.parser.Recovery;
import texparse.state.ParsingState;

/**
 * A malformed lexical construct. Carries a token standing in for the bad input, whose span is
 * what tolerant parsing marks as skipped, and where reading should resume.
 */
@SuppressWarnings("serial")
public class TokenParseException extends LatexParseException {
	private final Token recoveryToken;
	private final Recovery recovery;

	public TokenParseException(String message, int position, ParsingState parsingState, Token recoveryToken,
	                           Recovery recovery) {
		super(message, position, parsingState);
		this.recoveryToken = recoveryToken;
		this.recovery = recovery;
	}

	public Token getRecoveryToken() {
		return recoveryToken;
	}

	public Recovery getRecovery() {
		return recovery;
	}
}
