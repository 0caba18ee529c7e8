package texparse.util;

/**
 * A half-open range {@code [start, end)} of character offsets into a source text.
 */
public final class SourceSpan implements Comparable<SourceSpan> {
	private final int start;
	private final int end;

	public SourceSpan(int start, int end) {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("invalid source span [" + start + ", " + end + ")");
		}
		this.start = start;
		this.end = end;
	}

	public static SourceSpan empty(int pos) {
		return new SourceSpan(pos, pos);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean contains(int offset) {
		return offset >= start && offset < end;
	}

	public boolean contains(SourceSpan other) {
		return other.start >= start && other.end <= end;
	}

	public boolean overlaps(SourceSpan other) {
		return other.start < end && start < other.end;
	}

	public SourceSpan combine(SourceSpan other) {
		return new SourceSpan(Integer.min(start, other.start), Integer.max(end, other.end));
	}

	public String substring(CharSequence source) {
		return source.subSequence(start, end).toString();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + start;
		result = prime * result + end;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceSpan other = (SourceSpan) obj;
		return start == other.start && end == other.end;
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}

	@Override
	public int compareTo(SourceSpan o) {
		int comparedStart = Integer.compare(start, o.start);
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(end, o.end);
	}
}
