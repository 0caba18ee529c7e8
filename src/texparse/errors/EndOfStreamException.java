package texparse.errors;

/**
 * Raised by a token reader when only whitespace (or nothing) remains. The remaining whitespace is
 * carried so that callers can keep it in the node tree.
 */
@SuppressWarnings("serial")
public class EndOfStreamException extends LatexWalkerException {
	private final String finalSpace;

	public EndOfStreamException(String finalSpace) {
		super("end of stream");
		this.finalSpace = finalSpace;
	}

	public String getFinalSpace() {
		return finalSpace;
	}
}
