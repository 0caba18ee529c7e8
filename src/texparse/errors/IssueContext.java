package texparse.errors;

public abstract class IssueContext {

	public abstract void error(Issue issue);

	public abstract boolean hasErrors();
}
