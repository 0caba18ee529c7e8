package texparse.walker;

import texparse.errors.Issue;
import texparse.parser.CarryoverInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a top-level parse produced: the value, the parser's carryover information, the offset
 * where parsing stopped, and the issues recovered from along the way.
 */
public final class ParseOutcome<T> {
	private final T value;
	private final CarryoverInfo carryover;
	private final int endPosition;
	private final List<Issue> issues;

	public ParseOutcome(T value, CarryoverInfo carryover, int endPosition, List<Issue> issues) {
		this.value = value;
		this.carryover = carryover;
		this.endPosition = endPosition;
		this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
	}

	public T getValue() {
		return value;
	}

	public CarryoverInfo getCarryover() {
		return carryover;
	}

	public int getEndPosition() {
		return endPosition;
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public boolean hasIssues() {
		return !issues.isEmpty();
	}
}
