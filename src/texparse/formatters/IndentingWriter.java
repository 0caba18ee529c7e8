package texparse.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line it starts with the current indentation. Indentation is
 * scoped with try-with-resources over {@link #indent()}.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private int indent = 0;
	private boolean shouldIndent = false;
	private int defaultIndent = 4;
	private int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write("\n");
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (shouldIndent) {
				for (int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
				horizontalPosition = indent;
			}
			int next = data.indexOf('\n', start);
			if (next == -1) {
				horizontalPosition += data.length() - start;
				out.write(data, start, data.length() - start);
				break;
			}
			out.write(data, start, next + 1 - start);
			horizontalPosition = 0;
			start = next + 1;
			shouldIndent = true;
		}
	}

}
