package texparse.context;

import texparse.errors.LatexParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.model.LatexNode;
import texparse.model.ParsedArguments;
import texparse.model.SpecialsNode;
import texparse.parser.ParseResult;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

public class SpecialsCallParser extends CallParser<SpecialsSpec> {

	public SpecialsCallParser(Token token, SpecialsSpec spec) {
		super(token, spec);
	}

	@Override
	protected String describeCall() {
		return "specials ‘" + spec.getSpecialsChars() + "’";
	}

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		ParsedArguments arguments = parseArguments(walker, reader, state);
		SpecialsNode node = new SpecialsNode(new SourceSpan(token.getStart(), endOf(arguments)), state,
				spec.getSpecialsChars(), spec, arguments);
		return ParseResult.success(node, spec.makeCarryoverInfo(node));
	}
}
