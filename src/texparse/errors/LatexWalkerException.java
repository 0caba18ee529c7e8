package texparse.errors;

/**
 * Base class of every checked condition raised while walking a LaTeX source.
 */
@SuppressWarnings("serial")
public abstract class LatexWalkerException extends Exception {

	public LatexWalkerException(String message) {
		super(message);
	}

	public LatexWalkerException(String message, Throwable cause) {
		super(message, cause);
	}
}
