package texparse.formatters;

import texparse.Unreachable;
import texparse.errors.LatexParseException;
import texparse.errors.OpenContext;
import texparse.util.LineIndex;
import texparse.util.SourceLocation;
import texparse.util.SourceSpan;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Renders parse errors for humans: the message, the offending line with a caret, and the
 * constructs that were open at the time.
 */
public class ErrorFormatter {
	private final CharSequence source;
	private final LineIndex lineIndex;

	public ErrorFormatter(CharSequence source) {
		this.source = source;
		this.lineIndex = new LineIndex(source);
	}

	public String format(LatexParseException error) {
		StringWriter w = new StringWriter();
		try {
			write(new IndentingWriter(w), error);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public void write(IndentingWriter out, LatexParseException error) throws IOException {
		out.write("error: ");
		out.write(error.getBaseMessage());
		SourceLocation location = error.getLocation();
		if (location == null) {
			location = lineIndex.locate(SourceSpan.empty(clamp(error.getPosition())));
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			location.writePretty(out, source);
			for (OpenContext context : error.getOpenContexts()) {
				out.newLine();
				out.write("while parsing ");
				out.write(context.getDescription());
				out.write(" at ");
				out.write(lineIndex.locate(context.getSpan()).positionString());
			}
		}
	}

	private int clamp(int position) {
		return Integer.max(0, Integer.min(position, source.length()));
	}
}
