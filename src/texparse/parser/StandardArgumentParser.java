package texparse.parser;

import texparse.lexer.DelimiterPair;
import texparse.model.LatexNode;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps argument descriptors to parsers.
 *
 * <table>
 * <caption>Descriptors</caption>
 * <tr><td>{@code m} or {@code &#123;}</td><td>mandatory expression</td></tr>
 * <tr><td>{@code o} or {@code [}</td><td>optional {@code [...]} group</td></tr>
 * <tr><td>{@code s} or {@code *}</td><td>optional star</td></tr>
 * <tr><td>{@code t}<i>c</i></td><td>optional marker character <i>c</i></td></tr>
 * <tr><td>{@code r}<i>ab</i></td><td>mandatory group delimited by <i>a</i> and <i>b</i></td></tr>
 * <tr><td>{@code d}<i>ab</i></td><td>optional group delimited by <i>a</i> and <i>b</i></td></tr>
 * <tr><td>{@code v}</td><td>verbatim delimited by the character that follows</td></tr>
 * <tr><td>{@code v}<i>ab</i></td><td>verbatim delimited by <i>a</i> and <i>b</i></td></tr>
 * </table>
 */
public final class StandardArgumentParser {

	private static final Map<String, LatexParser<? extends LatexNode>> cache = new ConcurrentHashMap<>();

	private StandardArgumentParser() {
	}

	public static LatexParser<? extends LatexNode> forDescriptor(String descriptor) {
		return cache.computeIfAbsent(descriptor, StandardArgumentParser::makeParser);
	}

	private static LatexParser<? extends LatexNode> makeParser(String descriptor) {
		switch (descriptor) {
			case "m":
			case "{":
				return new ExpressionParser();
			case "o":
			case "[":
				return new DelimitedGroupParser(new DelimiterPair("[", "]"), true, true);
			case "s":
			case "*":
				return new OptionalCharsMarkerParser("*");
			case "v":
				return new DelimitedVerbatimParser();
			default:
				break;
		}
		if (descriptor.length() == 2 && descriptor.charAt(0) == 't') {
			return new OptionalCharsMarkerParser(descriptor.substring(1));
		}
		if (descriptor.length() == 3) {
			DelimiterPair delimiters = new DelimiterPair(descriptor.substring(1, 2), descriptor.substring(2, 3));
			switch (descriptor.charAt(0)) {
				case 'r':
					return new DelimitedGroupParser(delimiters, false, true);
				case 'd':
					return new DelimitedGroupParser(delimiters, true, true);
				case 'v':
					return new DelimitedVerbatimParser(delimiters);
				default:
					break;
			}
		}
		throw new IllegalArgumentException("invalid argument descriptor ‘" + descriptor + "’");
	}
}
