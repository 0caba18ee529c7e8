package texparse.state;

public class ReplaceParsingState extends ParsingStateDelta {
	private final ParsingState replacement;

	public ReplaceParsingState(ParsingState replacement) {
		this.replacement = replacement;
	}

	public ParsingState getReplacement() {
		return replacement;
	}

	@Override
	public ParsingState apply(ParsingState state, ParsingStateEventHandler handler) {
		return replacement;
	}
}
