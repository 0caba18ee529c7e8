package texparse.parser;

import org.junit.Test;
import texparse.context.LatexContextDb;
import texparse.context.MacroSpec;
import texparse.context.StandardContext;
import texparse.errors.LatexParseException;
import texparse.lexer.DelimiterPair;
import texparse.model.GroupNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.model.MacroNode;
import texparse.state.ExtendContextDb;
import texparse.walker.LatexWalker;
import texparse.walker.LatexWalkerOptions;
import texparse.walker.ParseOutcome;

import java.util.Collections;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;
import static texparse.TestingUtils.shape;

public class NodeParsersTest {

	private static <T> ParseOutcome<T> run(LatexParser<T> parser, String source) throws LatexParseException {
		LatexWalker walker = LatexWalker.withStandardContext(source, new LatexWalkerOptions());
		return walker.parse(parser, 0, walker.getInitialParsingState());
	}

	@Test
	public void commaSeparatedList() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new CommaSeparatedListParser(), "{a, b,,c} rest");
		assertThat(shape(outcome.getValue()), is("g[{|g[|c\"a\"|,] g[|c\" b\"|,] g[|c\"c\"|]|}]"));
		assertThat(outcome.getEndPosition(), is(9));
	}

	@Test
	public void commaSeparatedListKeepingEmptyParts() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new CommaSeparatedListParser(new DelimiterPair("{", "}"), false, true),
				"{a,,{b,c}}");
		assertThat(shape(outcome.getValue()), is("g[{|g[|c\"a\"|,] g[||,] g[|g[{|c\"b,c\"|}]|]|}]"));
	}

	@Test
	public void charsGroupIgnoresMacros() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new CharsGroupParser(), "{fig:a\\b}");
		assertThat(shape(outcome.getValue()), is("g[{|c\"fig:a\\b\"|}]"));
	}

	@Test
	public void missingOptionalGroupLeavesReader() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new DelimitedGroupParser(new DelimiterPair("[", "]"), true, true),
				"{x}");
		assertThat(outcome.getValue(), is(nullValue()));
		assertThat(outcome.getEndPosition(), is(0));
	}

	@Test
	public void optionalGroupWithoutPreSpace() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new DelimitedGroupParser(new DelimiterPair("[", "]"), true, false),
				" [x]");
		assertThat(outcome.getValue(), is(nullValue()));
	}

	@Test
	public void starMarker() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new OptionalCharsMarkerParser("*"), "*abc");
		assertThat(shape(outcome.getValue()), is("c\"*\""));
		assertThat(outcome.getEndPosition(), is(1));
		assertThat(run(new OptionalCharsMarkerParser("*"), "abc").getValue(), is(nullValue()));
	}

	@Test
	public void terminatedVerbatim() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = run(new TerminatedVerbatimParser("END"), "a \\b{ END tail");
		assertThat(shape(outcome.getValue()), is("c\"a \\b{ \""));
		assertThat(outcome.getEndPosition(), is(6));
	}

	@Test
	public void unterminatedDelimitedVerbatimIsIncomplete() throws LatexParseException {
		ParseOutcome<LatexNode> outcome = run(new DelimitedVerbatimParser(), "|abc");
		assertThat(shape(outcome.getValue()), is("g[||c\"abc\"|...]"));
		assertThat(outcome.getIssues().size(), is(1));
	}

	@Test
	public void verbatimEnvironment() throws LatexParseException {
		assertThat(shape("\\begin{verbatim}x = \\y{\\end{verbatim}z"), is("env:verbatim{c\"x = \\y{\"} c\"z\""));
	}

	@Test
	public void unterminatedVerbatimEnvironment() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = LatexWalker.withStandardContext("\\begin{verbatim}abc",
				new LatexWalkerOptions()).parse();
		assertThat(shape(outcome.getValue()), is("env:verbatim{c\"abc\"}..."));
		assertThat(outcome.getIssues().size(), is(1));
	}

	@Test
	public void singleNodeSkipsWhitespaceAndComments() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = run(new SingleNodeParser(), "  % c\n\\emph{x} rest");
		assertThat(shape(outcome.getValue()), is("c\"  \" %\" c\" \\emph(g[{|c\"x\"|}])"));
		assertThat(outcome.getEndPosition(), is(14));
	}

	@Test
	public void singleNodeAtEndOfInput() throws LatexParseException {
		ParseOutcome<LatexNodeList> outcome = run(new SingleNodeParser(), "   ");
		assertThat(shape(outcome.getValue()), is("c\"   \""));
		assertThat(outcome.getIssues().isEmpty(), is(true));
	}

	@Test
	public void carryoverExtendsContextForFollowingNodes() throws LatexParseException {
		MacroSpec foo = new MacroSpec("foo", "{");
		MacroSpec defineFoo = new MacroSpec("definefoo", Collections.emptyList(), null,
				node -> CarryoverInfo.applyDelta(new ExtendContextDb(Collections.singletonList(foo),
						Collections.emptyList(), Collections.emptyList())));
		LatexContextDb db = new LatexContextDb();
		db.addContextCategory("defs", Collections.singletonList(defineFoo), Collections.emptyList(),
				Collections.emptyList());
		db.setUnknownMacroSpec(new MacroSpec(""));

		LatexNodeList nodes = new LatexWalker("\\foo{a}\\definefoo\\foo{b}", db).parse().getValue();
		assertThat(shape(nodes), is("\\foo g[{|c\"a\"|}] \\definefoo \\foo(g[{|c\"b\"|}])"));
		assertThat(((MacroNode) nodes.get(3)).getSpec(), is(sameInstance(foo)));
		assertThat(nodes.get(0).getParsingState().getContextDb(), is(sameInstance(db)));
		assertThat(nodes.get(3).getParsingState().getContextDb().findMacroSpec("foo"), is(sameInstance(foo)));
	}

	@Test
	public void parserOverrideReplacesArgumentParsing() throws LatexParseException {
		MacroSpec raw = new MacroSpec("raw", Collections.emptyList(),
				token -> (walker, reader, state) -> walker.parseContent(new DelimitedVerbatimParser(), reader, state,
						null), null);
		LatexContextDb db = new LatexContextDb();
		db.addContextCategory("raw", Collections.singletonList(raw), Collections.emptyList(),
				Collections.emptyList());
		LatexNodeList nodes = new LatexWalker("\\raw<\\x>y", db).parse().getValue();
		assertThat(shape(nodes), is("g[<|c\"\\x\"|>] c\"y\""));
		assertThat(((GroupNode) nodes.get(0)).getDelimiters(), is(new DelimiterPair("<", ">")));
	}

	@Test
	public void standardContextIsUsable() {
		assertThat(StandardContext.getDefault().findMacroSpec("frac"), is(notNullValue()));
	}
}
