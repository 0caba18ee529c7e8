package texparse.lexer;

public enum TokenType {
	CHARS,
	MACRO,
	BEGIN_ENVIRONMENT,
	END_ENVIRONMENT,
	COMMENT,
	GROUP_OPEN,
	GROUP_CLOSE,
	MATH_INLINE,
	MATH_DISPLAY,
	SPECIALS;

	public boolean isMathDelimiter() {
		return this == MATH_INLINE || this == MATH_DISPLAY;
	}
}
