package texparse.state;

import texparse.lexer.Token;

/**
 * Resolves walker events raised by parsing-state deltas. Embedding code can override these to
 * customise what entering and leaving math mode means, or to react to observer events.
 */
public interface ParsingStateEventHandler {

	ParsingStateEventHandler DEFAULT = new ParsingStateEventHandler() {};

	default ParsingState enterMathMode(ParsingState state, String delimiter, Token trigger) {
		return state.toBuilder().setInMathMode(true).setMathModeDelimiter(delimiter).build();
	}

	default ParsingState leaveMathMode(ParsingState state, Token trigger) {
		return state.toBuilder().setInMathMode(false).setMathModeDelimiter(null).build();
	}

	default void observe(ObserverEvent event, ParsingState state) {
	}
}
