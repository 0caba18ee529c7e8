package texparse.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(RecoveredParseIssue recoveredParseIssue) throws E;
	public abstract T visit(UnknownConstructIssue unknownConstructIssue) throws E;
}
