package texparse.state;

import texparse.context.LatexContextDb;
import texparse.lexer.DelimiterPair;
import texparse.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable snapshot of the lexical and grammatical mode that a piece of source is read in.
 *
 * <p>Derived states are built with {@link #toBuilder()}; the original remains valid and can keep
 * being used for sibling constructs. Leaving math mode always clears the math-mode delimiter.</p>
 */
public final class ParsingState {

	/**
	 * A math-mode delimiter together with the token type it is read as.
	 */
	public static final class MathDelimiter {
		private final String delimiter;
		private final TokenType tokenType;

		MathDelimiter(String delimiter, TokenType tokenType) {
			this.delimiter = delimiter;
			this.tokenType = tokenType;
		}

		public String getDelimiter() {
			return delimiter;
		}

		public TokenType getTokenType() {
			return tokenType;
		}
	}

	private final String source;
	private final LatexContextDb contextDb;
	private final boolean inMathMode;
	private final String mathModeDelimiter;
	private final List<DelimiterPair> groupDelimiters;
	private final List<DelimiterPair> inlineMathDelimiters;
	private final List<DelimiterPair> displayMathDelimiters;
	private final boolean enableDoubleNewlineParagraphs;
	private final boolean enableEnvironments;
	private final boolean enableComments;
	private final boolean enableMacros;
	private final boolean enableGroups;
	private final boolean enableSpecials;
	private final boolean enableMath;
	private final char macroEscapeChar;
	private final String commentStart;
	private final String forbiddenCharacters;

	// every math delimiter, opening and closing, longest first
	private final List<MathDelimiter> mathDelimitersByLength;

	private ParsingState(Builder b) {
		this.source = b.source;
		this.contextDb = b.contextDb;
		this.inMathMode = b.inMathMode;
		this.mathModeDelimiter = b.inMathMode ? b.mathModeDelimiter : null;
		this.groupDelimiters = Collections.unmodifiableList(new ArrayList<>(b.groupDelimiters));
		this.inlineMathDelimiters = Collections.unmodifiableList(new ArrayList<>(b.inlineMathDelimiters));
		this.displayMathDelimiters = Collections.unmodifiableList(new ArrayList<>(b.displayMathDelimiters));
		this.enableDoubleNewlineParagraphs = b.enableDoubleNewlineParagraphs;
		this.enableEnvironments = b.enableEnvironments;
		this.enableComments = b.enableComments;
		this.enableMacros = b.enableMacros;
		this.enableGroups = b.enableGroups;
		this.enableSpecials = b.enableSpecials;
		this.enableMath = b.enableMath;
		this.macroEscapeChar = b.macroEscapeChar;
		this.commentStart = b.commentStart;
		this.forbiddenCharacters = b.forbiddenCharacters;

		List<MathDelimiter> delimiters = new ArrayList<>();
		for (DelimiterPair pair : inlineMathDelimiters) {
			addMathDelimiters(delimiters, pair, TokenType.MATH_INLINE);
		}
		for (DelimiterPair pair : displayMathDelimiters) {
			addMathDelimiters(delimiters, pair, TokenType.MATH_DISPLAY);
		}
		delimiters.sort((a, b2) -> Integer.compare(b2.getDelimiter().length(), a.getDelimiter().length()));
		this.mathDelimitersByLength = Collections.unmodifiableList(delimiters);
	}

	private static void addMathDelimiters(List<MathDelimiter> delimiters, DelimiterPair pair, TokenType type) {
		delimiters.add(new MathDelimiter(pair.getOpen(), type));
		if (!pair.getClose().equals(pair.getOpen())) {
			delimiters.add(new MathDelimiter(pair.getClose(), type));
		}
	}

	public static Builder builder(String source, LatexContextDb contextDb) {
		return new Builder(source, contextDb);
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public String getSource() {
		return source;
	}

	public LatexContextDb getContextDb() {
		return contextDb;
	}

	public boolean isInMathMode() {
		return inMathMode;
	}

	/**
	 * @return the delimiter that opened the current math region, or null outside math mode or in
	 * a math environment
	 */
	public String getMathModeDelimiter() {
		return mathModeDelimiter;
	}

	public List<DelimiterPair> getGroupDelimiters() {
		return groupDelimiters;
	}

	public List<DelimiterPair> getInlineMathDelimiters() {
		return inlineMathDelimiters;
	}

	public List<DelimiterPair> getDisplayMathDelimiters() {
		return displayMathDelimiters;
	}

	public boolean isEnableDoubleNewlineParagraphs() {
		return enableDoubleNewlineParagraphs;
	}

	public boolean isEnableEnvironments() {
		return enableEnvironments;
	}

	public boolean isEnableComments() {
		return enableComments;
	}

	public boolean isEnableMacros() {
		return enableMacros;
	}

	public boolean isEnableGroups() {
		return enableGroups;
	}

	public boolean isEnableSpecials() {
		return enableSpecials;
	}

	public boolean isEnableMath() {
		return enableMath;
	}

	public char getMacroEscapeChar() {
		return macroEscapeChar;
	}

	public String getCommentStart() {
		return commentStart;
	}

	public String getForbiddenCharacters() {
		return forbiddenCharacters;
	}

	public boolean isForbidden(char c) {
		return forbiddenCharacters.indexOf(c) != -1;
	}

	public boolean isMacroAlphaChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	public List<MathDelimiter> getMathDelimitersByLength() {
		return mathDelimitersByLength;
	}

	public boolean isMathDelimiterStart(char c) {
		for (MathDelimiter d : mathDelimitersByLength) {
			if (d.getDelimiter().charAt(0) == c) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the math delimiter pair opened by the given delimiter, or null if it is not an
	 * opening math delimiter
	 */
	public DelimiterPair findMathDelimiterPair(String open) {
		for (DelimiterPair pair : inlineMathDelimiters) {
			if (pair.getOpen().equals(open)) {
				return pair;
			}
		}
		for (DelimiterPair pair : displayMathDelimiters) {
			if (pair.getOpen().equals(open)) {
				return pair;
			}
		}
		return null;
	}

	/**
	 * @return the delimiter that would close the current math region, or null if the region was
	 * not opened by a delimiter
	 */
	public MathDelimiter getExpectedClosingMathDelimiter() {
		if (!inMathMode || mathModeDelimiter == null) {
			return null;
		}
		for (DelimiterPair pair : inlineMathDelimiters) {
			if (pair.getOpen().equals(mathModeDelimiter)) {
				return new MathDelimiter(pair.getClose(), TokenType.MATH_INLINE);
			}
		}
		for (DelimiterPair pair : displayMathDelimiters) {
			if (pair.getOpen().equals(mathModeDelimiter)) {
				return new MathDelimiter(pair.getClose(), TokenType.MATH_DISPLAY);
			}
		}
		return null;
	}

	public DelimiterPair findGroupDelimiterPairByOpen(String open) {
		for (DelimiterPair pair : groupDelimiters) {
			if (pair.getOpen().equals(open)) {
				return pair;
			}
		}
		return null;
	}

	public boolean isGroupOpen(char c) {
		for (DelimiterPair pair : groupDelimiters) {
			if (pair.getOpen().length() == 1 && pair.getOpen().charAt(0) == c) {
				return true;
			}
		}
		return false;
	}

	public boolean isGroupClose(char c) {
		for (DelimiterPair pair : groupDelimiters) {
			if (pair.getClose().length() == 1 && pair.getClose().charAt(0) == c) {
				return true;
			}
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(source, System.identityHashCode(contextDb), inMathMode, mathModeDelimiter,
				groupDelimiters, inlineMathDelimiters, displayMathDelimiters, enableDoubleNewlineParagraphs,
				enableEnvironments, enableComments, enableMacros, enableGroups, enableSpecials, enableMath,
				macroEscapeChar, commentStart, forbiddenCharacters);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ParsingState other = (ParsingState) obj;
		return Objects.equals(source, other.source) && contextDb == other.contextDb &&
				inMathMode == other.inMathMode && Objects.equals(mathModeDelimiter, other.mathModeDelimiter) &&
				groupDelimiters.equals(other.groupDelimiters) &&
				inlineMathDelimiters.equals(other.inlineMathDelimiters) &&
				displayMathDelimiters.equals(other.displayMathDelimiters) &&
				enableDoubleNewlineParagraphs == other.enableDoubleNewlineParagraphs &&
				enableEnvironments == other.enableEnvironments && enableComments == other.enableComments &&
				enableMacros == other.enableMacros && enableGroups == other.enableGroups &&
				enableSpecials == other.enableSpecials && enableMath == other.enableMath &&
				macroEscapeChar == other.macroEscapeChar && commentStart.equals(other.commentStart) &&
				forbiddenCharacters.equals(other.forbiddenCharacters);
	}

	@Override
	public String toString() {
		return "ParsingState [inMathMode=" + inMathMode + ", mathModeDelimiter=" + mathModeDelimiter +
				", groupDelimiters=" + groupDelimiters + ", enableMacros=" + enableMacros + ", enableSpecials=" +
				enableSpecials + ", enableMath=" + enableMath + ", enableComments=" + enableComments + "]";
	}

	public static final class Builder {
		private String source;
		private LatexContextDb contextDb;
		private boolean inMathMode = false;
		private String mathModeDelimiter = null;
		private List<DelimiterPair> groupDelimiters = Collections.singletonList(new DelimiterPair("{", "}"));
		private List<DelimiterPair> inlineMathDelimiters = Arrays.asList(
				new DelimiterPair("$", "$"), new DelimiterPair("\\(", "\\)"));
		private List<DelimiterPair> displayMathDelimiters = Arrays.asList(
				new DelimiterPair("$$", "$$"), new DelimiterPair("\\[", "\\]"));
		private boolean enableDoubleNewlineParagraphs = true;
		private boolean enableEnvironments = true;
		private boolean enableComments = true;
		private boolean enableMacros = true;
		private boolean enableGroups = true;
		private boolean enableSpecials = true;
		private boolean enableMath = true;
		private char macroEscapeChar = '\\';
		private String commentStart = "%";
		private String forbiddenCharacters = "";

		private Builder(String source, LatexContextDb contextDb) {
			this.source = source;
			this.contextDb = contextDb;
		}

		private Builder(ParsingState s) {
			this.source = s.source;
			this.contextDb = s.contextDb;
			this.inMathMode = s.inMathMode;
			this.mathModeDelimiter = s.mathModeDelimiter;
			this.groupDelimiters = s.groupDelimiters;
			this.inlineMathDelimiters = s.inlineMathDelimiters;
			this.displayMathDelimiters = s.displayMathDelimiters;
			this.enableDoubleNewlineParagraphs = s.enableDoubleNewlineParagraphs;
			this.enableEnvironments = s.enableEnvironments;
			this.enableComments = s.enableComments;
			this.enableMacros = s.enableMacros;
			this.enableGroups = s.enableGroups;
			this.enableSpecials = s.enableSpecials;
			this.enableMath = s.enableMath;
			this.macroEscapeChar = s.macroEscapeChar;
			this.commentStart = s.commentStart;
			this.forbiddenCharacters = s.forbiddenCharacters;
		}

		public Builder setSource(String source) {
			this.source = source;
			return this;
		}

		public Builder setContextDb(LatexContextDb contextDb) {
			this.contextDb = contextDb;
			return this;
		}

		public Builder setInMathMode(boolean inMathMode) {
			this.inMathMode = inMathMode;
			return this;
		}

		public Builder setMathModeDelimiter(String mathModeDelimiter) {
			this.mathModeDelimiter = mathModeDelimiter;
			return this;
		}

		public Builder setGroupDelimiters(List<DelimiterPair> groupDelimiters) {
			this.groupDelimiters = groupDelimiters;
			return this;
		}

		public Builder addGroupDelimiter(DelimiterPair pair) {
			if (!groupDelimiters.contains(pair)) {
				List<DelimiterPair> extended = new ArrayList<>(groupDelimiters);
				extended.add(pair);
				groupDelimiters = extended;
			}
			return this;
		}

		public Builder setInlineMathDelimiters(List<DelimiterPair> inlineMathDelimiters) {
			this.inlineMathDelimiters = inlineMathDelimiters;
			return this;
		}

		public Builder setDisplayMathDelimiters(List<DelimiterPair> displayMathDelimiters) {
			this.displayMathDelimiters = displayMathDelimiters;
			return this;
		}

		public Builder setEnableDoubleNewlineParagraphs(boolean enable) {
			this.enableDoubleNewlineParagraphs = enable;
			return this;
		}

		public Builder setEnableEnvironments(boolean enable) {
			this.enableEnvironments = enable;
			return this;
		}

		public Builder setEnableComments(boolean enable) {
			this.enableComments = enable;
			return this;
		}

		public Builder setEnableMacros(boolean enable) {
			this.enableMacros = enable;
			return this;
		}

		public Builder setEnableGroups(boolean enable) {
			this.enableGroups = enable;
			return this;
		}

		public Builder setEnableSpecials(boolean enable) {
			this.enableSpecials = enable;
			return this;
		}

		public Builder setEnableMath(boolean enable) {
			this.enableMath = enable;
			return this;
		}

		public Builder setMacroEscapeChar(char macroEscapeChar) {
			this.macroEscapeChar = macroEscapeChar;
			return this;
		}

		public Builder setCommentStart(String commentStart) {
			if (commentStart.isEmpty()) {
				throw new IllegalArgumentException("comment start must not be empty");
			}
			this.commentStart = commentStart;
			return this;
		}

		public Builder setForbiddenCharacters(String forbiddenCharacters) {
			this.forbiddenCharacters = forbiddenCharacters;
			return this;
		}

		public ParsingState build() {
			return new ParsingState(this);
		}
	}
}
