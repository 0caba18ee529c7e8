package texparse.util;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SourceSpanTest {

	@Test
	public void containsIsHalfOpen() {
		SourceSpan span = new SourceSpan(2, 5);
		assertThat(span.contains(2), is(true));
		assertThat(span.contains(4), is(true));
		assertThat(span.contains(5), is(false));
		assertThat(span.length(), is(3));
	}

	@Test
	public void emptySpansDoNotOverlapAnything() {
		assertThat(SourceSpan.empty(3).overlaps(new SourceSpan(0, 10)), is(false));
		assertThat(new SourceSpan(0, 3).overlaps(new SourceSpan(3, 6)), is(false));
		assertThat(new SourceSpan(0, 4).overlaps(new SourceSpan(3, 6)), is(true));
	}

	@Test
	public void combineCoversBoth() {
		assertThat(new SourceSpan(4, 6).combine(new SourceSpan(1, 2)), is(new SourceSpan(1, 6)));
		assertThat(new SourceSpan(0, 10).contains(new SourceSpan(4, 6)), is(true));
	}

	@Test
	public void substring() {
		assertThat(new SourceSpan(6, 11).substring("hello world"), is("world"));
	}

	@Test
	public void ordering() {
		assertThat(new SourceSpan(1, 2).compareTo(new SourceSpan(1, 3)) < 0, is(true));
		assertThat(new SourceSpan(2, 2).compareTo(new SourceSpan(1, 3)) > 0, is(true));
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsReversedRange() {
		new SourceSpan(5, 4);
	}
}
