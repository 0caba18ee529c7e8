package texparse.errors;

import texparse.util.SourceLocation;

/**
 * Something that went wrong during a tolerant parse and was recovered from.
 */
public abstract class Issue {
	private final SourceLocation location;

	public Issue(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public abstract String getMessage();

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getMessage() + " at " + location.positionString();
	}
}
