package texparse.lexer;

import texparse.context.SpecialsSpec;
import texparse.util.SourceSpan;
import texparse.util.SourceSpanned;

import java.util.Objects;

/**
 * A single lexical unit read by a {@link TokenReader}.
 *
 * <p>The span of macro and comment tokens includes their post-space. The pre-space (whitespace
 * skipped before the token) is not part of the span; it immediately precedes it.</p>
 */
public final class Token implements SourceSpanned {
	private final TokenType type;
	private final String value;
	private final SourceSpan span;
	private final String preSpace;
	private final String postSpace;
	private final SpecialsSpec specialsSpec;

	public Token(TokenType type, String value, SourceSpan span, String preSpace, String postSpace,
	             SpecialsSpec specialsSpec) {
		this.type = type;
		this.value = value;
		this.span = span;
		this.preSpace = preSpace;
		this.postSpace = postSpace;
		this.specialsSpec = specialsSpec;
	}

	public Token(TokenType type, String value, int start, int end, String preSpace) {
		this(type, value, new SourceSpan(start, end), preSpace, "", null);
	}

	public static Token specials(SpecialsSpec spec, int start, int end, String preSpace) {
		return new Token(TokenType.SPECIALS, spec.getSpecialsChars(), new SourceSpan(start, end), preSpace, "",
				spec);
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * The characters of a chars token, the name of a macro or environment, the text of a comment,
	 * a delimiter, or the characters of a specials sequence.
	 */
	public String getValue() {
		return value;
	}

	@Override
	public SourceSpan getSpan() {
		return span;
	}

	public String getPreSpace() {
		return preSpace;
	}

	public String getPostSpace() {
		return postSpace;
	}

	public int getStartIncludingPreSpace() {
		return span.getStart() - preSpace.length();
	}

	public SpecialsSpec getSpecialsSpec() {
		return specialsSpec;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, span, preSpace, postSpace);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Token other = (Token) obj;
		return type == other.type && value.equals(other.value) && span.equals(other.span) &&
				preSpace.equals(other.preSpace) && postSpace.equals(other.postSpace) &&
				specialsSpec == other.specialsSpec;
	}

	@Override
	public String toString() {
		return "Token [type=" + type + ", value=" + quote(value) + ", span=" + span + ", preSpace=" +
				quote(preSpace) + ", postSpace=" + quote(postSpace) + "]";
	}

	private static String quote(String s) {
		return "'" + s.replace("\n", "\\n") + "'";
	}
}
