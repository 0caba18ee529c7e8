package texparse.context;

import texparse.lexer.Token;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.parser.CarryoverInfo;
import texparse.parser.LatexParser;
import texparse.parser.TerminatedVerbatimParser;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class EnvironmentSpec extends CallableSpec {
	private final String name;
	private final boolean mathMode;
	private final LatexParser<LatexNodeList> bodyParser;

	public EnvironmentSpec(String name) {
		this(name, Collections.emptyList());
	}

	public EnvironmentSpec(String name, String argumentShorthand) {
		this(name, ArgumentSpec.parseShorthand(argumentShorthand));
	}

	public EnvironmentSpec(String name, List<ArgumentSpec> arguments) {
		this(name, arguments, false);
	}

	public EnvironmentSpec(String name, List<ArgumentSpec> arguments, boolean mathMode) {
		this(name, arguments, mathMode, null);
	}

	/**
	 * @param bodyParser parses the environment body instead of the general node parser; it must
	 *                   leave the token reader either after the {@code \end} token (reporting it
	 *                   as consumed stop token) or right before it. May be null.
	 */
	public EnvironmentSpec(String name, List<ArgumentSpec> arguments, boolean mathMode,
	                       LatexParser<LatexNodeList> bodyParser) {
		this(name, arguments, mathMode, bodyParser, null, null);
	}

	public EnvironmentSpec(String name, List<ArgumentSpec> arguments, boolean mathMode,
	                       LatexParser<LatexNodeList> bodyParser,
	                       Function<Token, LatexParser<? extends LatexNode>> parserOverride,
	                       Function<LatexNode, CarryoverInfo> carryoverHook) {
		super(arguments, parserOverride, carryoverHook);
		this.name = name;
		this.mathMode = mathMode;
		this.bodyParser = bodyParser;
	}

	/**
	 * An environment whose body is kept as raw characters up to {@code \end{name}}.
	 */
	public static EnvironmentSpec verbatim(String name, List<ArgumentSpec> arguments) {
		return new EnvironmentSpec(name, arguments, false, new TerminatedVerbatimParser("\\end{" + name + "}"));
	}

	public static EnvironmentSpec verbatim(String name) {
		return verbatim(name, Collections.emptyList());
	}

	public String getName() {
		return name;
	}

	public boolean isMathMode() {
		return mathMode;
	}

	/**
	 * @return the body parser override, or null to parse the body as general LaTeX
	 */
	public LatexParser<LatexNodeList> getBodyParser() {
		return bodyParser;
	}

	@Override
	protected LatexParser<? extends LatexNode> makeDefaultNodeParser(Token token) {
		return new EnvironmentCallParser(token, this);
	}

	@Override
	public String toString() {
		return "EnvironmentSpec [name=" + name + ", arguments=" + getArguments() + ", mathMode=" + mathMode + "]";
	}
}
