package texparse.parser;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import texparse.errors.LatexParseException;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static texparse.TestingUtils.shape;

@RunWith(Parameterized.class)
public class ArgumentParsingTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"\\frac12", "\\frac(c\"1\",c\"2\")"},
				{"\\frac{a}{b}", "\\frac(g[{|c\"a\"|}],g[{|c\"b\"|}])"},
				{"\\frac {a} b", "\\frac(g[{|c\"a\"|}],c\"b\")"},
				{"\\frac\\alpha\\beta", "\\frac(\\alpha,\\beta)"},
				{"\\sqrt[3]{x}", "\\sqrt(g[[|c\"3\"|]],g[{|c\"x\"|}])"},
				{"\\sqrt{x}", "\\sqrt(-,g[{|c\"x\"|}])"},
				{"\\section*{Intro}", "\\section(c\"*\",-,g[{|c\"Intro\"|}])"},
				{"\\section[Short]{Long}", "\\section(-,g[[|c\"Short\"|]],g[{|c\"Long\"|}])"},
				{"\\item[a] b", "\\item(g[[|c\"a\"|]]) c\" b\""},
				{"\\item a", "\\item(-) c\"a\""},
				{"\\\\[2pt]", "\\\\(-,g[[|c\"2pt\"|]])"},
				{"\\'e", "\\'(c\"e\")"},
				{"\\emph{}", "\\emph(g[{||}])"},
				{"\\textbf{a \\emph{b}}", "\\textbf(g[{|c\"a \" \\emph(g[{|c\"b\"|}])|}])"},
				{"\\verb|abc|def", "\\verb(g[||c\"abc\"||]) c\"def\""},
				{"\\verb+a b+", "\\verb(g[++c\"a b\"++])"},
				{"\\verb{a{b}c}", "\\verb(g[{|c\"a{b}c\"|}])"},
				{"a~b", "c\"a\" s\"~\" c\"b\""},
				{"\\begin{tabular}{ll}a & b\\end{tabular}",
						"env:tabular(-,g[{|c\"ll\"|}]){c\"a \" s\"&\" c\" b\"}"},
				{"\\begin{theorem}[Euclid]x\\end{theorem}", "env:theorem(g[[|c\"Euclid\"|]]){c\"x\"}"},
		});
	}

	private final String source;
	private final String expected;

	public ArgumentParsingTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws LatexParseException {
		assertThat(shape(source), is(expected));
	}
}
