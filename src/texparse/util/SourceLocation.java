package texparse.util;

import texparse.Unreachable;
import texparse.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A {@link SourceSpan} resolved against its source text into line and column numbers.
 * Lines and columns are stored 0-based and printed 1-based.
 */
public class SourceLocation {
	private final SourceSpan span;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(SourceSpan span, int startLine, int endLine, int startColumn, int endColumn) {
		this.span = span;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString(CharSequence source) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), source);
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out, CharSequence source) {
		try {
			out.write("at ");
			out.write(positionString());
			out.newLine();
			int startOffset = span.getStart();
			int endOffset = span.getEnd();
			int lineStart = startOffset;
			while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
				lineStart--;
			}
			int lineEnd = endOffset;
			while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
				lineEnd++;
			}
			if (startLine != endLine) {
				for (int pos = lineStart; pos < startOffset; pos++) {
					out.append(' ');
				}
				for (int pos = startOffset; pos < endOffset && source.charAt(pos) != '\n'; pos++) {
					out.append('v');
				}
				out.newLine();
			}
			int lastLineBegin = lineStart;
			for (int pos = lineStart; pos < lineEnd; pos++) {
				if (source.charAt(pos) == '\n') {
					lastLineBegin = pos + 1;
				}
			}
			out.append(source, lineStart, lineEnd);
			out.newLine();
			int caretStart = Integer.max(startOffset, lastLineBegin);
			for (int pos = lastLineBegin; pos < caretStart; pos++) {
				out.append(' ');
			}
			int effectiveEndOffset = startOffset == endOffset ? endOffset + 1 : endOffset;
			for (int pos = caretStart; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
			}
			if (startOffset == source.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public String positionString() {
		if (startLine != endLine) {
			return (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn;
		} else if (startColumn != endColumn) {
			return (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn;
		} else {
			return (startLine + 1) + ":" + (startColumn + 1);
		}
	}

	public SourceSpan getSpan() {
		return span;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + span.hashCode();
		result = prime * result + startLine;
		result = prime * result + endLine;
		result = prime * result + startColumn;
		result = prime * result + endColumn;
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
		SourceLocation other = (SourceLocation) obj;
		return span.equals(other.span) && startLine == other.startLine && endLine == other.endLine &&
				startColumn == other.startColumn && endColumn == other.endColumn;
	}

	@Override
	public String toString() {
		return "SourceLocation [span=" + span + ", startLine=" + startLine + ", endLine=" + endLine +
				", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
	}
}
