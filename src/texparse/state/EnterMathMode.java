package texparse.state;

import texparse.lexer.Token;

/**
 * Enters math mode. The delimiter is null for math environments, which are closed by their
 * {@code \end} rather than by a delimiter.
 */
public class EnterMathMode extends ParsingStateDelta {
	private final String delimiter;
	private final Token trigger;

	public EnterMathMode(String delimiter, Token trigger) {
		this.delimiter = delimiter;
		this.trigger = trigger;
	}

	public String getDelimiter() {
		return delimiter;
	}

	public Token getTrigger() {
		return trigger;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		return handler.enterMathMode(state, delimiter, trigger);
	}
}
