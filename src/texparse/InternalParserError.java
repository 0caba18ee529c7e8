package texparse;

public class InternalParserError extends RuntimeException {
	public InternalParserError(String message) {
		super("internal parser error: " + message);
	}

	public InternalParserError(Exception e) {
		super("internal parser error", e);
	}
}
