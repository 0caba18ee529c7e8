package texparse.errors;

import texparse.state.ParsingState;
import texparse.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parse error located at a source offset. The open contexts record the enclosing constructs,
 * innermost first, and are filled in as the error propagates outward.
 */
@SuppressWarnings("serial")
public class LatexParseException extends LatexWalkerException {
	private final String baseMessage;
	private final int position;
	private final transient ParsingState parsingState;
	private final List<OpenContext> openContexts = new ArrayList<>();
	private SourceLocation location;

	public LatexParseException(String message, int position, ParsingState parsingState) {
		super(message);
		this.baseMessage = message;
		this.position = position;
		this.parsingState = parsingState;
	}

	public LatexParseException(String message, int position, ParsingState parsingState, Throwable cause) {
		super(message, cause);
		this.baseMessage = message;
		this.position = position;
		this.parsingState = parsingState;
	}

	public String getBaseMessage() {
		return baseMessage;
	}

	public int getPosition() {
		return position;
	}

	public ParsingState getParsingState() {
		return parsingState;
	}

	public void addOpenContext(OpenContext context) {
		openContexts.add(context);
	}

	public List<OpenContext> getOpenContexts() {
		return Collections.unmodifiableList(openContexts);
	}

	/**
	 * @return the line and column of the error, once the walker that raised it has located it
	 */
	public SourceLocation getLocation() {
		return location;
	}

	public void setLocation(SourceLocation location) {
		this.location = location;
	}

	@Override
	public String getMessage() {
		if (location != null) {
			return baseMessage + " @ " + location.positionString();
		}
		return baseMessage + " @ " + position;
	}
}
