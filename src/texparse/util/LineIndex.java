package texparse.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to line and column numbers. Lines and columns are 0-based internally,
 * matching {@link SourceLocation}; callers that display them add one.
 */
public class LineIndex {
	private final CharSequence source;
	private final int[] lineStarts;

	public LineIndex(CharSequence source) {
		this.source = source;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < source.length(); ++i) {
			if (source.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		lineStarts = new int[starts.size()];
		for (int i = 0; i < lineStarts.length; ++i) {
			lineStarts[i] = starts.get(i);
		}
	}

	public CharSequence getSource() {
		return source;
	}

	public int getLineCount() {
		return lineStarts.length;
	}

	public int getLine(int offset) {
		if (offset < 0 || offset > source.length()) {
			throw new IndexOutOfBoundsException("offset " + offset + " outside of source of length " +
					source.length());
		}
		int lo = 0;
		int hi = lineStarts.length - 1;
		while (lo < hi) {
			int mid = (lo + hi + 1) >>> 1;
			if (lineStarts[mid] <= offset) {
				lo = mid;
			} else {
				hi = mid - 1;
			}
		}
		return lo;
	}

	public int getColumn(int offset) {
		return offset - lineStarts[getLine(offset)];
	}

	public int getLineStart(int line) {
		return lineStarts[line];
	}

	public SourceLocation locate(SourceSpan span) {
		return new SourceLocation(span, getLine(span.getStart()), getLine(span.getEnd()),
				getColumn(span.getStart()), getColumn(span.getEnd()));
	}
}
