package texparse.errors;

import texparse.Unreachable;
import texparse.formatters.IndentingWriter;
import texparse.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public void format(IndentingWriter out, CharSequence source) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(issues.size()));
		out.write(" issue(s):");
		for (Issue issue : issues) {
			out.newLine();
			issue.accept(new IssueFormattingVisitor(out, source));
		}
	}

	public String format(CharSequence source) {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w), source);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
