package texparse.parser;

import texparse.lexer.Token;
import texparse.state.ParsingState;
import texparse.state.ParsingStateDelta;
import texparse.state.ParsingStateEventHandler;

/**
 * Information a parser hands back to its caller besides the parsed value: how the parsing
 * state should change for whatever follows, and why the parser stopped.
 */
public final class CarryoverInfo {
	private static final CarryoverInfo EMPTY = new CarryoverInfo(null, null, null, false, false);

	private final ParsingState parsingState;
	private final ParsingStateDelta delta;
	private final Token stopToken;
	private final boolean stopTokenConsumed;
	private final boolean reachedEndOfStream;

	private CarryoverInfo(ParsingState parsingState, ParsingStateDelta delta, Token stopToken,
	                      boolean stopTokenConsumed, boolean reachedEndOfStream) {
		this.parsingState = parsingState;
		this.delta = delta;
		this.stopToken = stopToken;
		this.stopTokenConsumed = stopTokenConsumed;
		this.reachedEndOfStream = reachedEndOfStream;
	}

	public static CarryoverInfo empty() {
		return EMPTY;
	}

	public static CarryoverInfo setParsingState(ParsingState parsingState) {
		return new CarryoverInfo(parsingState, null, null, false, false);
	}

	public static CarryoverInfo applyDelta(ParsingStateDelta delta) {
		return new CarryoverInfo(null, delta, null, false, false);
	}

	/**
	 * @param consumed false if the stop token was left for an enclosing parser to read
	 */
	public CarryoverInfo withStopToken(Token stopToken, boolean consumed) {
		return new CarryoverInfo(parsingState, delta, stopToken, consumed, reachedEndOfStream);
	}

	public CarryoverInfo withEndOfStream() {
		return new CarryoverInfo(parsingState, delta, stopToken, stopTokenConsumed, true);
	}

	public CarryoverInfo withoutStopInformation() {
		return new CarryoverInfo(parsingState, delta, null, false, false);
	}

	public ParsingState getParsingState() {
		return parsingState;
	}

	public ParsingStateDelta getDelta() {
		return delta;
	}

	/**
	 * @return the token that made the parser stop, or null
	 */
	public Token getStopToken() {
		return stopToken;
	}

	public boolean isStopTokenConsumed() {
		return stopTokenConsumed;
	}

	public boolean isReachedEndOfStream() {
		return reachedEndOfStream;
	}

	public boolean changesParsingState() {
		return parsingState != null || delta != null;
	}

	public ParsingState getUpdatedParsingState(ParsingState current, ParsingStateEventHandler handler) {
		ParsingState updated = parsingState != null ? parsingState : current;
		if (delta != null) {
			updated = delta.apply(updated, handler);
		}
		return updated;
	}
}
