package texparse;

import java.io.IOException;

/**
 * Thrown where control cannot arrive, such as an exhausted switch over a closed set of kinds or
 * an IOException from an in-memory writer.
 */
@SuppressWarnings("serial")
public class Unreachable extends RuntimeException {

	public Unreachable() {
		super("reached code that should be unreachable");
	}

	public Unreachable(IOException inMemoryWriterFailure) {
		super("in-memory writer failed", inMemoryWriterFailure);
	}
}
