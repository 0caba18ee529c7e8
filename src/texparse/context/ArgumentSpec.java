package texparse.context;

import texparse.model.LatexNode;
import texparse.parser.LatexParser;
import texparse.parser.StandardArgumentParser;
import texparse.state.ParsingStateDelta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One argument of a macro, environment or specials call.
 *
 * <p>The argument shape is given either by a descriptor understood by
 * {@link StandardArgumentParser} ({@code m}, {@code o}, {@code s}, {@code t<c>}, {@code r<ab>},
 * {@code d<ab>}, {@code v}, {@code v<ab>}, with the aliases {@code {}, {@code [} and {@code *}) or
 * by an explicit parser. An optional parsing-state delta is applied while the argument is read,
 * e.g. to leave math mode for the argument of {@code \text}.</p>
 */
public final class ArgumentSpec {
	private final String descriptor;
	private final LatexParser<? extends LatexNode> parser;
	private final String name;
	private final ParsingStateDelta parsingStateDelta;

	public ArgumentSpec(String descriptor) {
		this(descriptor, null, null);
	}

	public ArgumentSpec(String descriptor, String name) {
		this(descriptor, name, null);
	}

	public ArgumentSpec(String descriptor, String name, ParsingStateDelta parsingStateDelta) {
		this.descriptor = descriptor;
		this.parser = StandardArgumentParser.forDescriptor(descriptor);
		this.name = name;
		this.parsingStateDelta = parsingStateDelta;
	}

	public ArgumentSpec(LatexParser<? extends LatexNode> parser, String name, ParsingStateDelta parsingStateDelta) {
		this.descriptor = null;
		this.parser = parser;
		this.name = name;
		this.parsingStateDelta = parsingStateDelta;
	}

	/**
	 * Splits a compact argument signature like {@code "*[{"} into one spec per character.
	 * Only the single-character descriptors can be written this way.
	 */
	public static List<ArgumentSpec> parseShorthand(String shorthand) {
		List<ArgumentSpec> specs = new ArrayList<>();
		for (int i = 0; i < shorthand.length(); ++i) {
			char c = shorthand.charAt(i);
			if (Character.isWhitespace(c)) {
				continue;
			}
			if ("{[*mos".indexOf(c) == -1) {
				throw new IllegalArgumentException("‘" + c + "’ in argument signature ‘" + shorthand +
						"’ cannot be used in shorthand, use an explicit ArgumentSpec");
			}
			specs.add(new ArgumentSpec(String.valueOf(c)));
		}
		return Collections.unmodifiableList(specs);
	}

	/**
	 * @return the descriptor, or null if the argument uses an explicit parser
	 */
	public String getDescriptor() {
		return descriptor;
	}

	public LatexParser<? extends LatexNode> getParser() {
		return parser;
	}

	/**
	 * @return the argument name, or null for an anonymous argument
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the delta applied to the parsing state while reading this argument, or null
	 */
	public ParsingStateDelta getParsingStateDelta() {
		return parsingStateDelta;
	}

	@Override
	public String toString() {
		return "ArgumentSpec [" + (descriptor != null ? descriptor : parser) +
				(name != null ? ", name=" + name : "") + "]";
	}
}
