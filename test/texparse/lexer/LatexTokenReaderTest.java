package texparse.lexer;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import texparse.context.StandardContext;
import texparse.errors.EndOfStreamException;
import texparse.errors.TokenParseException;
import texparse.state.ParsingState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class LatexTokenReaderTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"Hello world", Arrays.asList("CHARS Hello", "CHARS world")},
				{"ab12cd", Arrays.asList("CHARS ab12cd")},
				{"a,b", Arrays.asList("CHARS a", "CHARS ,", "CHARS b")},
				{"x^2", Arrays.asList("CHARS x", "CHARS ^", "CHARS 2")},
				{"\\textbf{x}", Arrays.asList("MACRO textbf", "GROUP_OPEN {", "CHARS x", "GROUP_CLOSE }")},
				{"\\\\ x", Arrays.asList("MACRO \\", "CHARS x")},
				{"\\% x", Arrays.asList("MACRO %", "CHARS x")},
				{"\\beginning", Arrays.asList("MACRO beginning")},
				{"\\begin{itemize}\\end{itemize}",
						Arrays.asList("BEGIN_ENVIRONMENT itemize", "END_ENVIRONMENT itemize")},
				{"\\begin {equation*}", Arrays.asList("BEGIN_ENVIRONMENT equation*")},
				{"% note\nx", Arrays.asList("COMMENT  note", "CHARS x")},
				{"$x$", Arrays.asList("MATH_INLINE $", "CHARS x", "MATH_INLINE $")},
				{"$$x$$", Arrays.asList("MATH_DISPLAY $$", "CHARS x", "MATH_DISPLAY $$")},
				{"\\(x\\)", Arrays.asList("MATH_INLINE \\(", "CHARS x", "MATH_INLINE \\)")},
				{"\\[x\\]", Arrays.asList("MATH_DISPLAY \\[", "CHARS x", "MATH_DISPLAY \\]")},
				{"a---b", Arrays.asList("CHARS a", "SPECIALS ---", "CHARS b")},
				{"a--b", Arrays.asList("CHARS a", "SPECIALS --", "CHARS b")},
				{"a~b", Arrays.asList("CHARS a", "SPECIALS ~", "CHARS b")},
				{"a&b", Arrays.asList("CHARS a", "SPECIALS &", "CHARS b")},
				{"``q''", Arrays.asList("SPECIALS ``", "CHARS q", "SPECIALS ''")},
				{"x\n\ny", Arrays.asList("CHARS x", "SPECIALS \n\n", "CHARS y")},
				{"x\ny", Arrays.asList("CHARS x", "CHARS y")},
				{"[a]", Arrays.asList("CHARS [", "CHARS a", "CHARS ]")},
		});
	}

	private final String source;
	private final List<String> expected;

	public LatexTokenReaderTest(String source, List<String> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws TokenParseException {
		LatexTokenReader reader = new LatexTokenReader(source);
		ParsingState state = ParsingState.builder(source, StandardContext.getDefault()).build();
		List<String> actual = new ArrayList<>();
		while (true) {
			try {
				Token token = reader.nextToken(state);
				actual.add(token.getType() + " " + token.getValue());
			} catch (EndOfStreamException e) {
				break;
			}
		}
		assertThat(actual, is(expected));
	}
}
