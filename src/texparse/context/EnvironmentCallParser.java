package texparse.context;

import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.errors.OpenContext;
import texparse.errors.TokenParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.lexer.TokenType;
import texparse.model.EnvironmentNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.model.ParsedArguments;
import texparse.parser.CarryoverInfo;
import texparse.parser.GeneralNodesParser;
import texparse.parser.LatexParser;
import texparse.parser.ParseResult;
import texparse.parser.Recovery;
import texparse.state.EnterMathMode;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

/**
 * Parses {@code \begin{name}}, its arguments, the body and the matching {@code \end{name}}.
 */
public class EnvironmentCallParser extends CallParser<EnvironmentSpec> {

	public EnvironmentCallParser(Token token, EnvironmentSpec spec) {
		super(token, spec);
	}

	@Override
	protected String describeCall() {
		return "environment ‘{" + token.getValue() + "}’";
	}

	private boolean isEndToken(Token t) {
		return t.getType() == TokenType.END_ENVIRONMENT && t.getValue().equals(token.getValue());
	}

	@Override
	public ParseResult<LatexNode> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		ParsedArguments arguments = parseArguments(walker, reader, state);

		ParsingState bodyState = state;
		if (spec.isMathMode()) {
			bodyState = new EnterMathMode(null, token).apply(state, walker);
		}
		LatexParser<LatexNodeList> bodyParser = spec.getBodyParser();
		if (bodyParser == null) {
			bodyParser = new GeneralNodesParser(this::isEndToken, null, true,
					"Unexpected end of stream, expected ‘\\end{" + token.getValue() + "}’");
		}
		ParseResult.Success<LatexNodeList> body = walker.parseContent(bodyParser, reader, bodyState,
				new OpenContext(describeCall(), token.getSpan()));
		CarryoverInfo bodyCarryover = body.getCarryover();

		boolean incomplete = bodyCarryover.isReachedEndOfStream();
		Token endToken = null;
		if (bodyCarryover.getStopToken() != null && isEndToken(bodyCarryover.getStopToken())) {
			endToken = bodyCarryover.getStopToken();
			if (!bodyCarryover.isStopTokenConsumed()) {
				reader.movePastToken(endToken);
			}
		} else if (!incomplete) {
			// a body parser override may leave the \end token to us
			Token next;
			try {
				next = reader.peekToken(state);
			} catch (EndOfStreamException e) {
				next = null;
			} catch (TokenParseException e) {
				next = e.getRecoveryToken();
			}
			if (next != null && isEndToken(next)) {
				reader.movePastToken(next);
				endToken = next;
			} else {
				int position = next != null ? next.getStart() : reader.getPosition();
				EnvironmentNode partial = makeNode(state, arguments, body.getValue(), null, true);
				return ParseResult.failure(new NodesParseException("Expected ‘\\end{" + token.getValue() +
								"}’ after the body of " + describeCall(), position, state), partial,
						CarryoverInfo.empty(), Recovery.atPosition(reader.getPosition()));
			}
		}

		EnvironmentNode node = makeNode(state, arguments, body.getValue(), endToken, incomplete);
		return ParseResult.success(node, spec.makeCarryoverInfo(node));
	}

	private EnvironmentNode makeNode(ParsingState state, ParsedArguments arguments, LatexNodeList body,
	                                 Token endToken, boolean incomplete) {
		int end;
		if (endToken != null) {
			end = endToken.getEnd();
		} else {
			end = Integer.max(endOf(arguments), body.getSpan().getEnd());
		}
		return new EnvironmentNode(new SourceSpan(token.getStart(), end), state, token.getValue(), spec, arguments,
				body, incomplete);
	}
}
