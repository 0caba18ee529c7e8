package texparse.util;

/**
 * Anything that can be traced back to a range of the text it was parsed from.
 */
public interface SourceSpanned {

	SourceSpan getSpan();

	default int getStart() {
		return getSpan().getStart();
	}

	default int getEnd() {
		return getSpan().getEnd();
	}
}
