package texparse.state;

/**
 * A description of a transition from one parsing state to another. Applying a delta never
 * modifies the state it is applied to.
 */
public abstract class ParsingStateDelta {

	public abstract ParsingState apply(ParsingState state, ParsingStateEventHandler handler);

	public ParsingStateDelta andThen(ParsingStateDelta next) {
		return ChainedDelta.of(this, next);
	}
}
