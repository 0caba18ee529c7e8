package texparse.lexer;

import java.util.Objects;

/**
 * An opening and closing delimiter, e.g. a pair of braces or a pair of math-mode markers.
 */
public final class DelimiterPair {
	private final String open;
	private final String close;

	public DelimiterPair(String open, String close) {
		this.open = Objects.requireNonNull(open);
		this.close = Objects.requireNonNull(close);
	}

	public String getOpen() {
		return open;
	}

	public String getClose() {
		return close;
	}

	@Override
	public int hashCode() {
		return Objects.hash(open, close);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		DelimiterPair other = (DelimiterPair) obj;
		return open.equals(other.open) && close.equals(other.close);
	}

	@Override
	public String toString() {
		return "(" + open + ", " + close + ")";
	}
}
