package texparse.formatters;

import texparse.errors.IssueVisitor;
import texparse.errors.RecoveredParseIssue;
import texparse.errors.UnknownConstructIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;
	private final CharSequence source;

	public IssueFormattingVisitor(IndentingWriter out, CharSequence source) {
		this.out = out;
		this.source = source;
	}

	@Override
	public Void visit(RecoveredParseIssue recoveredParseIssue) throws IOException {
		out.write("recovered from parse error: ");
		out.write(recoveredParseIssue.getMessage());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			recoveredParseIssue.getLocation().writePretty(out, source);
			out.newLine();
			out.write("resumed ");
			switch (recoveredParseIssue.getRecovery().getKind()) {
				case AT_TOKEN:
					out.write("at the offending token");
					break;
				case PAST_TOKEN:
					out.write("past the offending token");
					break;
				case AT_POSITION:
					out.write("at offset " + recoveredParseIssue.getRecovery().getPosition());
					break;
				case NEXT_LINE:
					out.write("on the next line");
					break;
				case NEXT_DELIMITER:
					out.write("at the next delimiter");
					break;
			}
		}
		return null;
	}

	@Override
	public Void visit(UnknownConstructIssue unknownConstructIssue) throws IOException {
		out.write("skipped ");
		out.write(unknownConstructIssue.getMessage());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			unknownConstructIssue.getLocation().writePretty(out, source);
		}
		return null;
	}
}
