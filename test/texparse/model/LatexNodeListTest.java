package texparse.model;

import org.junit.Test;
import texparse.errors.LatexParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;
import static texparse.TestingUtils.parse;
import static texparse.TestingUtils.shape;

public class LatexNodeListTest {

	private static List<String> shapes(List<LatexNodeList> parts) {
		List<String> result = new ArrayList<>();
		for (LatexNodeList part : parts) {
			result.add(shape(part));
		}
		return result;
	}

	@Test
	public void filterOutWhitespaceAndComments() throws LatexParseException {
		LatexNodeList nodes = parse("a \\emph{b} % c\n d");
		assertThat(nodes.size(), is(4));
		List<LatexNode> kept = nodes.filterOutWhitespaceAndComments();
		assertThat(kept.size(), is(3));
		assertThat(kept.get(1), is(instanceOf(MacroNode.class)));
		assertThat(nodes.filter(n -> n instanceof MacroNode).size(), is(1));
	}

	@Test
	public void splitAtChars() throws LatexParseException {
		LatexNodeList nodes = parse("a,b,\\emph{c},,d");
		assertThat(shapes(nodes.splitAtChars(",", false)),
				is(Arrays.asList("c\"a\"", "c\"b\"", "\\emph(g[{|c\"c\"|}])", "c\"d\"")));
		List<LatexNodeList> withEmpty = nodes.splitAtChars(",", true);
		assertThat(shapes(withEmpty),
				is(Arrays.asList("c\"a\"", "c\"b\"", "\\emph(g[{|c\"c\"|}])", "", "c\"d\"")));
		assertThat(withEmpty.get(1).getSpan().getStart(), is(2));
		assertThat(withEmpty.get(1).getLatexVerbatim(), is("b"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void splitNeedsSeparator() throws LatexParseException {
		parse("a").splitAtChars("", false);
	}

	@Test
	public void splitAtNode() throws LatexParseException {
		LatexNodeList nodes = parse("a & b & c");
		List<LatexNodeList> cells = nodes.splitAtNode(n -> n instanceof SpecialsNode);
		assertThat(shapes(cells), is(Arrays.asList("c\"a \"", "c\" b \"", "c\" c\"")));
	}

	@Test
	public void contentAsChars() throws LatexParseException {
		assertThat(parse("a{b}\\emph{c}~d % e\n").getContentAsChars(), is("ab~d "));
	}

	@Test
	public void descendantsInDocumentOrder() throws LatexParseException {
		LatexNodeList nodes = parse("\\frac{a}{b}c");
		List<String> kinds = new ArrayList<>();
		for (LatexNode node : nodes.descendants()) {
			kinds.add(node.getClass().getSimpleName() + " " + node.getLatexVerbatim());
		}
		assertThat(kinds, is(Arrays.asList(
				"MacroNode \\frac{a}{b}",
				"GroupNode {a}",
				"CharsNode a",
				"GroupNode {b}",
				"CharsNode b",
				"CharsNode c")));
	}

	@Test
	public void argumentsByName() throws LatexParseException {
		MacroNode sqrt = (MacroNode) parse("\\sqrt{x}").get(0);
		ParsedArguments arguments = sqrt.getArguments();
		assertThat(arguments.getArgument("root"), is(nullValue()));
		assertThat(arguments.getArgumentInfo("root").wasProvided(), is(false));
		assertThat(arguments.getArgumentInfo("root").getContentAsChars(), is(nullValue()));
		assertThat(arguments.getArgumentInfo("radicand").wasProvided(), is(true));
		assertThat(arguments.getArgumentInfo("radicand").getContentAsChars(), is("x"));
		assertThat(arguments.getArgumentInfo(1).getContentNodes().size(), is(1));
		assertThat(arguments.getProvidedArguments().size(), is(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownArgumentName() throws LatexParseException {
		((MacroNode) parse("\\sqrt{x}").get(0)).getArguments().getArgument("index");
	}

	@Test
	public void nodeEqualityIgnoresParsingState() throws LatexParseException {
		LatexNode a = parse("x\\emph{y}").get(1);
		LatexNode b = parse("z\\emph{y}").get(1);
		assertThat(a, is(b));
		assertThat(a.hashCode(), is(b.hashCode()));
		assertThat(parse("\\emph{y}").get(0), is(not(a)));
	}

	@Test
	public void emptyListHasEmptySpan() throws LatexParseException {
		LatexNodeList nodes = parse("");
		assertThat(nodes.isEmpty(), is(true));
		assertThat(nodes.getSpan().isEmpty(), is(true));
	}
}
