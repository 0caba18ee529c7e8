package texparse.state;

import java.util.function.Consumer;

/**
 * Derives a state by changing some of its attributes, e.g. disabling macros inside a
 * plain-text argument.
 */
public class UpdateParsingState extends ParsingStateDelta {
	private final Consumer<ParsingState.Builder> update;

	public UpdateParsingState(Consumer<ParsingState.Builder> update) {
		this.update = update;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		ParsingState.Builder builder = state.toBuilder();
		update.accept(builder);
		return builder.build();
	}
}
