package texparse.errors;

import texparse.parser.Recovery;
import texparse.util.SourceLocation;

public class RecoveredParseIssue extends Issue {
	private final LatexParseException error;
	private final Recovery recovery;

	public RecoveredParseIssue(LatexParseException error, SourceLocation location, Recovery recovery) {
		super(location);
		this.error = error;
		this.recovery = recovery;
	}

	public LatexParseException getError() {
		return error;
	}

	public Recovery getRecovery() {
		return recovery;
	}

	@Override
	public String getMessage() {
		return error.getBaseMessage();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
