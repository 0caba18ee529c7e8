package texparse.errors;

import texparse.util.SourceSpan;

/**
 * A construct that was being parsed when an error occurred, e.g. the macro whose argument failed.
 */
public final class OpenContext {
	private final String description;
	private final SourceSpan span;

	public OpenContext(String description, SourceSpan span) {
		this.description = description;
		this.span = span;
	}

	public String getDescription() {
		return description;
	}

	public SourceSpan getSpan() {
		return span;
	}

	@Override
	public String toString() {
		return description + " at " + span;
	}
}
