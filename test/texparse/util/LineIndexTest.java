package texparse.util;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class LineIndexTest {

	private static final String SOURCE = "first\nsecond\n\nfourth";

	@Test
	public void linesAndColumns() {
		LineIndex index = new LineIndex(SOURCE);
		assertThat(index.getLineCount(), is(4));
		assertThat(index.getLine(0), is(0));
		assertThat(index.getLine(5), is(0));
		assertThat(index.getLine(6), is(1));
		assertThat(index.getColumn(8), is(2));
		assertThat(index.getLine(13), is(2));
		assertThat(index.getLine(14), is(3));
		assertThat(index.getColumn(SOURCE.length()), is(6));
	}

	@Test
	public void locateAndPrint() {
		LineIndex index = new LineIndex(SOURCE);
		SourceLocation location = index.locate(new SourceSpan(7, 10));
		assertThat(location.getStartLine(), is(1));
		assertThat(location.getStartColumn(), is(1));
		assertThat(location.positionString(), is("2:2-4"));
		assertThat(location.prettyString(SOURCE), is("at 2:2-4\nsecond\n ^^^"));
	}

	@Test
	public void locateEndOfInput() {
		String source = "ab";
		SourceLocation location = new LineIndex(source).locate(SourceSpan.empty(2));
		assertThat(location.positionString(), is("1:3"));
		assertThat(location.prettyString(source), is("at 1:3\nab\n  ^ EOF"));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void offsetPastEnd() {
		new LineIndex("abc").getLine(4);
	}
}
