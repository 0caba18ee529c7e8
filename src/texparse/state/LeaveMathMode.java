package texparse.state;

import texparse.lexer.Token;

public class LeaveMathMode extends ParsingStateDelta {
	private final Token trigger;

	public LeaveMathMode(Token trigger) {
		this.trigger = trigger;
	}

	public LeaveMathMode() {
		this(null);
	}

	public Token getTrigger() {
		return trigger;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		if (!state.isInMathMode()) {
			return state;
		}
		return handler.leaveMathMode(state, trigger);
	}
}
