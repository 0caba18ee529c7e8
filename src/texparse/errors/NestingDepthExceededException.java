package texparse.errors;

import texparse.state.ParsingState;

/**
 * Raised when constructs are nested deeper than the configured limit. Never recovered from, even
 * when parsing tolerantly.
 */
@SuppressWarnings("serial")
public class NestingDepthExceededException extends LatexParseException {
	private final int limit;

	public NestingDepthExceededException(int limit, int position, ParsingState parsingState) {
		super("Maximum nesting depth of " + limit + " exceeded", position, parsingState);
		this.limit = limit;
	}

	public int getLimit() {
		return limit;
	}
}
