package texparse.parser;

import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.walker.LatexWalker;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Parses a sequence of nodes until a stop condition is met or the input ends.
 *
 * <p>Reaching the end of the input while a stop condition was expected fails with a recovery
 * value holding everything collected so far and a carryover marked as having reached the end
 * of the stream, which lets enclosing constructs mark themselves incomplete.</p>
 */
public class GeneralNodesParser implements LatexParser<LatexNodeList> {
	private final Predicate<Token> stopTokenCondition;
	private final Predicate<List<LatexNode>> stopNodeListCondition;
	private final boolean requireStopCondition;
	private final String stopConditionMessage;
	private final boolean consumeStopToken;
	private final UnaryOperator<ParsingState> childParsingState;

	/**
	 * Parses everything up to the end of the input.
	 */
	public GeneralNodesParser() {
		this(null, null, false, null);
	}

	public GeneralNodesParser(Predicate<Token> stopTokenCondition, Predicate<List<LatexNode>> stopNodeListCondition,
	                          boolean requireStopCondition, String stopConditionMessage) {
		this(stopTokenCondition, stopNodeListCondition, requireStopCondition, stopConditionMessage, true, null);
	}

	/**
	 * @param consumeStopToken  whether the stop token is read, or left for an enclosing parser
	 * @param childParsingState derives the parsing state of nested constructs; may be null
	 */
	public GeneralNodesParser(Predicate<Token> stopTokenCondition, Predicate<List<LatexNode>> stopNodeListCondition,
	                          boolean requireStopCondition, String stopConditionMessage, boolean consumeStopToken,
	                          UnaryOperator<ParsingState> childParsingState) {
		this.stopTokenCondition = stopTokenCondition;
		this.stopNodeListCondition = stopNodeListCondition;
		this.requireStopCondition = requireStopCondition;
		this.stopConditionMessage = stopConditionMessage;
		this.consumeStopToken = consumeStopToken;
		this.childParsingState = childParsingState;
	}

	public GeneralNodesParser withoutConsumingStopToken() {
		return new GeneralNodesParser(stopTokenCondition, stopNodeListCondition, requireStopCondition,
				stopConditionMessage, false, childParsingState);
	}

	public GeneralNodesParser withChildParsingState(UnaryOperator<ParsingState> childParsingState) {
		return new GeneralNodesParser(stopTokenCondition, stopNodeListCondition, requireStopCondition,
				stopConditionMessage, consumeStopToken, childParsingState);
	}

	@Override
	public ParseResult<LatexNodeList> parse(LatexWalker walker, TokenReader reader, ParsingState state)
			throws LatexParseException {
		int start = reader.getPosition();
		NodesCollector collector = new NodesCollector(walker, reader, state, stopTokenCondition,
				stopNodeListCondition, childParsingState);
		while (true) {
			NodesCollector.Status status = collector.processOneToken();
			switch (status) {
				case CONTINUE:
					break;
				case STOP_TOKEN: {
					Token stop = collector.getStopToken();
					if (consumeStopToken) {
						reader.movePastToken(stop);
					} else {
						reader.moveToToken(stop, false);
					}
					return ParseResult.success(collector.getNodeList(start, state),
							collector.getCarryover().withStopToken(stop, consumeStopToken));
				}
				case STOP_NODE_LIST:
					return ParseResult.success(collector.getNodeList(start, state), collector.getCarryover());
				case END_OF_STREAM:
					if (requireStopCondition && (stopTokenCondition != null || stopNodeListCondition != null)) {
						String message = stopConditionMessage != null ? stopConditionMessage
								: "Unexpected end of stream";
						return ParseResult.failure(new NodesParseException(message, reader.getPosition(), state),
								collector.getNodeList(start, state), collector.getCarryover().withEndOfStream(),
								Recovery.atPosition(reader.getPosition()));
					}
					return ParseResult.success(collector.getNodeList(start, state),
							collector.getCarryover().withEndOfStream());
				case ERROR:
					return ParseResult.failure(collector.getError(), collector.getNodeList(start, state),
							collector.getCarryover(), collector.getErrorRecovery());
			}
		}
	}
}
