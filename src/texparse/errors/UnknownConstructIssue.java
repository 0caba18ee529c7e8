package texparse.errors;

import texparse.util.SourceLocation;

/**
 * A macro, environment or specials name with no spec and no fallback, skipped during tolerant
 * parsing.
 */
public class UnknownConstructIssue extends Issue {
	private final UnknownConstructException cause;

	public UnknownConstructIssue(UnknownConstructException cause, SourceLocation location) {
		super(location);
		this.cause = cause;
	}

	public UnknownConstructException getCause() {
		return cause;
	}

	@Override
	public String getMessage() {
		return cause.getMessage();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
