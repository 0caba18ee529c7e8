package texparse.walker;

import org.junit.Test;
import texparse.context.ArgumentSpec;
import texparse.context.LatexContextDb;
import texparse.context.MacroSpec;
import texparse.context.SpecialsSpec;
import texparse.errors.Issue;
import texparse.errors.LatexParseException;
import texparse.errors.NestingDepthExceededException;
import texparse.errors.NodesParseException;
import texparse.errors.RecoveredParseIssue;
import texparse.errors.UnknownConstructException;
import texparse.errors.UnknownConstructIssue;
import texparse.formatters.IndentingWriter;
import texparse.formatters.IssueFormattingVisitor;
import texparse.formatters.LatexRecomposer;
import texparse.model.EnvironmentNode;
import texparse.model.LatexNodeList;
import texparse.model.MacroNode;
import texparse.model.MathDisplayType;
import texparse.model.MathNode;
import texparse.parser.CarryoverInfo;
import texparse.state.ObserverEvent;
import texparse.util.SourceSpan;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static texparse.TestingUtils.parseStrict;
import static texparse.TestingUtils.shape;

public class LatexWalkerTest {

	private static ParseOutcome<LatexNodeList> tolerant(String source) throws LatexParseException {
		return LatexWalker.withStandardContext(source, new LatexWalkerOptions()).parse();
	}

	private static LatexParseException strictFailure(String source) {
		try {
			parseStrict(source);
		} catch (LatexParseException e) {
			return e;
		}
		fail("expected a parse error for " + source);
		return null;
	}

	@Test
	public void basicDocument() throws LatexParseException {
		assertThat(shape("Hello \\textbf{world}!"), is("c\"Hello \" \\textbf(g[{|c\"world\"|}]) c\"!\""));
	}

	@Test
	public void paragraphBreak() throws LatexParseException {
		assertThat(shape("a\n\nb"), is("c\"a\" s\"\\n\\n\" c\"b\""));
	}

	@Test
	public void paragraphBreaksCanBeDisabled() throws LatexParseException {
		LatexNodeList nodes = LatexWalker.withStandardContext("a\n\nb",
				new LatexWalkerOptions().withDoubleNewlineParagraphs(false)).parse().getValue();
		assertThat(shape(nodes), is("c\"a\\n\\nb\""));
	}

	@Test
	public void inlineMathDelimitersAreDisambiguated() throws LatexParseException {
		LatexNodeList nodes = tolerant("$a$$b$").getValue();
		assertThat(shape(nodes), is("math[$|c\"a\"|$] math[$|c\"b\"|$]"));
		assertThat(((MathNode) nodes.get(0)).getDisplayType(), is(MathDisplayType.INLINE));
	}

	@Test
	public void displayMath() throws LatexParseException {
		LatexNodeList nodes = tolerant("$$x$$").getValue();
		assertThat(shape(nodes), is("math[$$|c\"x\"|$$]"));
		assertThat(((MathNode) nodes.get(0)).getDisplayType(), is(MathDisplayType.DISPLAY));
		assertThat(shape("\\[x\\]"), is("math[\\[|c\"x\"|\\]]"));
	}

	@Test
	public void mathModeIsRecordedInParsingState() throws LatexParseException {
		LatexNodeList nodes = tolerant("a $b$").getValue();
		MathNode math = (MathNode) nodes.get(1);
		assertThat(nodes.get(0).getParsingState().isInMathMode(), is(false));
		assertThat(math.getNodes().get(0).getParsingState().isInMathMode(), is(true));
		assertThat(math.getNodes().get(0).getParsingState().getMathModeDelimiter(), is("$"));
	}

	@Test
	public void mathEnvironmentBodyIsInMathMode() throws LatexParseException {
		LatexNodeList nodes = tolerant("\\begin{equation}x\\end{equation}").getValue();
		assertThat(shape(nodes), is("env:equation{c\"x\"}"));
		assertThat(((EnvironmentNode) nodes.get(0)).getBody().get(0).getParsingState()
				.isInMathMode(), is(true));
	}

	@Test
	public void textArgumentLeavesMathMode() throws LatexParseException {
		LatexNodeList nodes = tolerant("$\\text{a}$").getValue();
		MathNode math = (MathNode) nodes.get(0);
		MacroNode text = (MacroNode) math.getNodes().get(0);
		assertThat(text.getParsingState().isInMathMode(), is(true));
		assertThat(text.getArguments().getArgument("text").getParsingState().isInMathMode(), is(false));
	}

	@Test
	public void nestedMathIsAnError() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("$a \\(b\\) c$");
		assertThat(shape(outcome.getValue()), is("math[$|c\"a \" ERR c\"b\" ERR c\" c\"|$]"));
		assertThat(outcome.getIssues().size(), is(2));
		assertThat(outcome.getIssues().get(0).getMessage(),
				is("Unexpected math mode delimiter ‘\\(’, already in math mode"));

		LatexParseException e = strictFailure("$a \\(b\\)$");
		assertThat(e, is(instanceOf(NodesParseException.class)));
		assertThat(e.getBaseMessage(), is("Unexpected math mode delimiter ‘\\(’, already in math mode"));
	}

	@Test
	public void strayClosingMathDelimiter() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("a\\)b");
		assertThat(shape(outcome.getValue()), is("c\"a\" ERR c\"b\""));
		assertThat(outcome.getIssues().get(0).getMessage(), is("Unexpected closing math mode token ‘\\)’"));
	}

	@Test
	public void specialsUseLongestMatch() throws LatexParseException {
		LatexContextDb db = new LatexContextDb();
		db.addContextCategory("dashes", Collections.emptyList(), Collections.emptyList(),
				Arrays.asList(new SpecialsSpec("-"), new SpecialsSpec("--")));
		LatexNodeList nodes = new LatexWalker("a---b", db).parse().getValue();
		assertThat(shape(nodes), is("c\"a\" s\"--\" s\"-\" c\"b\""));
		assertThat(shape("a---b"), is("c\"a\" s\"---\" c\"b\""));
	}

	@Test
	public void unknownMacroFallsBackWhenConfigured() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("\\mymacro{x}");
		assertThat(shape(outcome.getValue()), is("\\mymacro g[{|c\"x\"|}]"));
		assertThat(outcome.hasIssues(), is(false));
	}

	private static LatexContextDb contextWithoutFallback() {
		LatexContextDb db = new LatexContextDb();
		db.addContextCategory("known", Collections.singletonList(new MacroSpec("known")), Collections.emptyList(),
				Collections.emptyList());
		return db;
	}

	@Test
	public void unknownMacroWithoutFallbackIsRecordedInTolerantMode() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = new LatexWalker("\\known \\unknown b", contextWithoutFallback())
				.parse();
		assertThat(shape(outcome.getValue()), is("\\known ERR c\"b\""));
		assertThat(outcome.getIssues().size(), is(1));
		Issue issue = outcome.getIssues().get(0);
		assertThat(issue, is(instanceOf(UnknownConstructIssue.class)));
		assertThat(((UnknownConstructIssue) issue).getCause().getName(), is("unknown"));
	}

	@Test
	public void unknownMacroWithoutFallbackFailsStrictParsing() {
		LatexWalker walker = new LatexWalker("\\known \\unknown b", contextWithoutFallback(),
				new LatexWalkerOptions().withTolerantParsing(false));
		try {
			walker.parse();
			fail("expected an unknown macro error");
		} catch (LatexParseException e) {
			assertThat(e.getCause(), is(instanceOf(UnknownConstructException.class)));
			assertThat(e.getPosition(), is(7));
		}
	}

	@Test
	public void unclosedEnvironmentInTolerantMode() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("\\begin{itemize}\\item a");
		assertThat(shape(outcome.getValue()), is("env:itemize{\\item(-) c\"a\"}..."));
		assertThat(outcome.getIssues().size(), is(1));
		assertThat(outcome.getIssues().get(0), is(instanceOf(RecoveredParseIssue.class)));
	}

	@Test
	public void unclosedEnvironmentInStrictMode() {
		LatexParseException e = strictFailure("\\begin{itemize}\\item a");
		assertThat(e, is(instanceOf(NodesParseException.class)));
		assertThat(e.getBaseMessage(), is("Unexpected end of stream, expected ‘\\end{itemize}’"));
		assertThat(e.getOpenContexts().get(0).getDescription(), is("environment ‘{itemize}’"));
		assertThat(e.getLocation(), is(notNullValue()));
	}

	@Test
	public void mismatchedClosers() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("a}b \\end{itemize} c");
		assertThat(shape(outcome.getValue()), is("c\"a\" ERR c\"b \" ERR c\" c\""));
		assertThat(outcome.getIssues().get(0).getMessage(), is("Unexpected mismatching closing delimiter ‘}’"));
		assertThat(outcome.getIssues().get(1).getMessage(), is("Unexpected closing environment: ‘itemize’"));

		assertThat(strictFailure("a}b").getBaseMessage(), is("Unexpected mismatching closing delimiter ‘}’"));
	}

	@Test
	public void spaceBeforeRecoveredTokenIsKeptOnce() throws LatexParseException {
		LatexNodeList nodes = tolerant("a }b").getValue();
		assertThat(shape(nodes), is("c\"a \" ERR c\"b\""));
		assertThat(nodes.get(0).getSpan(), is(new SourceSpan(0, 2)));
		assertThat(nodes.get(1).getSpan(), is(new SourceSpan(2, 3)));

		nodes = tolerant("x \\end{itemize} y").getValue();
		assertThat(shape(nodes), is("c\"x \" ERR c\" y\""));
		assertThat(nodes.get(1).getStart(), is(2));

		nodes = tolerant("$a \\(b\\) c$").getValue();
		assertThat(LatexRecomposer.recompose(nodes), is("$a \\(b\\) c$"));
	}

	@Test
	public void unclosedGroup() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = tolerant("{a \\emph{b}");
		assertThat(shape(outcome.getValue()), is("g[{|c\"a \" \\emph(g[{|c\"b\"|}])|...]"));
		assertThat(outcome.getIssues().size(), is(1));
	}

	@Test(expected = NestingDepthExceededException.class)
	public void nestingDepthLimitIsFatalEvenWhenTolerant() throws LatexParseException {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 20; ++i) {
			sb.append('{');
		}
		LatexWalker.withStandardContext(sb.toString(), new LatexWalkerOptions().withMaxNestingDepth(10)).parse();
	}

	@Test
	public void deepButBoundedNesting() throws LatexParseException {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 50; ++i) {
			sb.append('{');
		}
		sb.append('x');
		for (int i = 0; i < 50; ++i) {
			sb.append('}');
		}
		ParseOutcome<LatexNodeList> outcome = tolerant(sb.toString());
		assertThat(outcome.getValue().size(), is(1));
		assertThat(outcome.getValue().descendants().size(), is(51));
		assertThat(outcome.hasIssues(), is(false));
	}

	@Test
	public void parseFromOffset() throws LatexParseException {
		LatexNodeList nodes = LatexWalker.withStandardContext("abc \\emph{x}", new LatexWalkerOptions())
				.parseFrom(4).getValue();
		assertThat(shape(nodes), is("\\emph(g[{|c\"x\"|}])"));
		assertThat(nodes.getStart(), is(4));
	}

	@Test
	public void commentsCanBeDropped() throws LatexParseException {
		assertThat(shape("a % c\nb"), is("c\"a \" %\" c\" c\"b\""));
		LatexNodeList nodes = LatexWalker.withStandardContext("a % c\nb",
				new LatexWalkerOptions().withKeepComments(false)).parse().getValue();
		assertThat(shape(nodes), is("c\"a \" c\"b\""));
	}

	@Test
	public void macroArgumentsInExpressions() throws LatexParseException {
		assertThat(shape("\\frac\\sqrt{2}3"), is("\\frac(\\sqrt,g[{|c\"2\"|}]) c\"3\""));
		LatexNodeList nodes = LatexWalker.withStandardContext("\\frac\\sqrt{2}3",
				new LatexWalkerOptions().withMacroArgumentsInExpressions(true)).parse().getValue();
		assertThat(shape(nodes), is("\\frac(\\sqrt(-,g[{|c\"2\"|}]),c\"3\")"));
	}

	@Test
	public void observerEventsReachListeners() throws LatexParseException {
		MacroSpec mark = new MacroSpec("mark", ArgumentSpec.parseShorthand("{"), null,
				node -> CarryoverInfo.applyDelta(new ObserverEvent("mark", node.getLatexVerbatim())));
		LatexContextDb db = new LatexContextDb();
		db.addContextCategory("marks", Collections.singletonList(mark), Collections.emptyList(),
				Collections.emptyList());
		LatexWalker walker = new LatexWalker("\\mark{a} x \\mark{b}", db);
		List<String> seen = new ArrayList<>();
		walker.addParsingStateListener((event, state) -> seen.add(event.getName() + ":" + event.getPayload()));
		walker.parse();
		assertThat(seen, is(Arrays.asList("mark:\\mark{a}", "mark:\\mark{b}")));
	}

	@Test
	public void errorsAreFormattedWithOpenContexts() {
		String source = "ab\n\\emph{c";
		LatexWalker walker = LatexWalker.withStandardContext(source,
				new LatexWalkerOptions().withTolerantParsing(false));
		try {
			walker.parse();
			fail("expected a parse error");
		} catch (LatexParseException e) {
			assertThat(e.getLocation().getStartLine(), is(2));
			String formatted = walker.formatError(e);
			assertThat(formatted, containsString("error: Unexpected end of stream while looking for closing ‘}’"));
			assertThat(formatted, containsString("while parsing argument #1"));
			assertThat(formatted, containsString("while parsing macro ‘\\emph’"));
		}
	}

	@Test
	public void issuesAreFormatted() throws LatexParseException, IOException {
		String source = "a}b";
		ParseOutcome<LatexNodeList> outcome = tolerant(source);
		StringWriter w = new StringWriter();
		outcome.getIssues().get(0).accept(new IssueFormattingVisitor(new IndentingWriter(w), source));
		assertThat(w.toString(), containsString("recovered from parse error: Unexpected mismatching closing delimiter ‘}’"));
		assertThat(w.toString(), containsString("resumed past the offending token"));
	}

	@Test
	public void contextDatabaseIsFrozenByTheWalker() {
		LatexContextDb db = new LatexContextDb();
		new LatexWalker("x", db);
		assertThat(db.isFrozen(), is(true));
	}

	@Test
	public void optionsFromJson() {
		LatexWalkerOptions options = LatexWalkerOptions.fromJson(
				"{\"tolerantParsing\": false, \"maxNestingDepth\": 100, \"macroArgumentsInExpressions\": true}");
		assertThat(options.isTolerantParsing(), is(false));
		assertThat(options.getMaxNestingDepth(), is(100));
		assertThat(options.isKeepComments(), is(true));
		assertThat(options.isDoubleNewlineParagraphs(), is(true));
		assertThat(options.isMacroArgumentsInExpressions(), is(true));
	}

	@Test(expected = IllegalArgumentException.class)
	public void nestingDepthMustBePositive() {
		new LatexWalkerOptions().withMaxNestingDepth(0);
	}
}
