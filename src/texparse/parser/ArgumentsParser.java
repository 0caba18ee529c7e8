package texparse.parser;

import texparse.context.ArgumentSpec;
import texparse.errors.LatexParseException;
import texparse.errors.OpenContext;
import texparse.lexer.TokenReader;
import texparse.model.LatexNode;
import texparse.model.ParsedArguments;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the arguments of a call in order. Absent optional arguments are recorded as null.
 */
public class ArgumentsParser implements LatexParser<ParsedArguments> {
	private final List<ArgumentSpec> argumentSpecs;

	public ArgumentsParser(List<ArgumentSpec> argumentSpecs) {
		this.argumentSpecs = argumentSpecs;
	}

	@Override
	public ParseResult<ParsedArguments> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		int start = reader.getPosition();
		int end = start;
		List<LatexNode> arguments = new ArrayList<>();
		for (int i = 0; i < argumentSpecs.size(); ++i) {
			ArgumentSpec spec = argumentSpecs.get(i);
			ParsingState argumentState = state;
			if (spec.getParsingStateDelta() != null) {
				argumentState = spec.getParsingStateDelta().apply(state, walker);
			}
			String description = "argument #" + (i + 1) + (spec.getName() != null ? " (" + spec.getName() + ")" : "");
			ParseResult.Success<? extends LatexNode> result = walker.parseContent(spec.getParser(), reader,
					argumentState, new OpenContext(description, SourceSpan.empty(reader.getPosition())));
			LatexNode argument = result.getValue();
			arguments.add(argument);
			if (argument != null) {
				end = Integer.max(end, argument.getEnd());
			}
		}
		return ParseResult.success(new ParsedArguments(argumentSpecs, arguments, new SourceSpan(start, end)));
	}
}
