package texparse.parser;

import texparse.InternalParserError;
import texparse.Unreachable;
import texparse.context.CallableSpec;
import texparse.context.ConstructKind;
import texparse.errors.EndOfStreamException;
import texparse.errors.LatexParseException;
import texparse.errors.NodesParseException;
import texparse.errors.OpenContext;
import texparse.errors.TokenParseException;
import texparse.errors.UnknownConstructException;
import texparse.lexer.DelimiterPair;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.lexer.TokenType;
import texparse.model.CharsNode;
import texparse.model.CommentNode;
import texparse.model.ErrorNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.walker.LatexWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Reads tokens one at a time and turns them into nodes, dispatching each construct to the
 * parser its spec provides.
 *
 * <p>Adjacent character tokens, along with the whitespace between them, are merged into a
 * single {@link CharsNode}. Whitespace in front of any other token becomes part of the
 * preceding characters, or a characters node of its own, so that the collected nodes tile the
 * input.</p>
 *
 * <p>In tolerant mode, a structural error is recorded as an issue and the skipped input is
 * covered by an {@link ErrorNode}. Otherwise collection stops and the error is handed to the
 * owning parser.</p>
 */
public class NodesCollector {

	public enum Status {
		CONTINUE,
		STOP_TOKEN,
		STOP_NODE_LIST,
		END_OF_STREAM,
		ERROR
	}

	private final LatexWalker walker;
	private final TokenReader reader;
	private final Predicate<Token> stopTokenCondition;
	private final Predicate<List<LatexNode>> stopNodeListCondition;
	private final UnaryOperator<ParsingState> childParsingState;
	private ParsingState state;

	private final List<LatexNode> nodes = new ArrayList<>();
	private final StringBuilder pendingChars = new StringBuilder();
	private int pendingCharsStart = -1;
	private boolean stopNodeListMet = false;

	private Token stopToken;
	private LatexParseException error;
	private Recovery errorRecovery;
	private CarryoverInfo carryover = CarryoverInfo.empty();

	/**
	 * @param stopTokenCondition    stops collection when a token satisfies it; may be null
	 * @param stopNodeListCondition stops collection once the collected nodes satisfy it; may be null
	 * @param childParsingState     derives the parsing state handed to nested constructs; may be null
	 */
	public NodesCollector(LatexWalker walker, TokenReader reader, ParsingState state,
	                      Predicate<Token> stopTokenCondition, Predicate<List<LatexNode>> stopNodeListCondition,
	                      UnaryOperator<ParsingState> childParsingState) {
		this.walker = walker;
		this.reader = reader;
		this.state = state;
		this.stopTokenCondition = stopTokenCondition;
		this.stopNodeListCondition = stopNodeListCondition;
		this.childParsingState = childParsingState;
	}

	public List<LatexNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public LatexNodeList getNodeList(int emptyPosition, ParsingState listState) {
		return LatexNodeList.of(nodes, emptyPosition, listState);
	}

	/**
	 * @return the parsing state in effect after the nodes collected so far
	 */
	public ParsingState getParsingState() {
		return state;
	}

	public Token getStopToken() {
		return stopToken;
	}

	public LatexParseException getError() {
		return error;
	}

	public Recovery getErrorRecovery() {
		return errorRecovery;
	}

	/**
	 * @return the carryover of the last construct that changed the parsing state, to be passed
	 * on to whoever continues after the collected nodes
	 */
	public CarryoverInfo getCarryover() {
		return carryover;
	}

	public Status processOneToken() throws LatexParseException {
		int iterationStart = reader.getPosition();
		Status status = readAndDispatch();
		if (status == Status.CONTINUE && reader.getPosition() <= iterationStart) {
			return noProgress(iterationStart);
		}
		return status;
	}

	private Status readAndDispatch() throws LatexParseException {
		Token tok;
		try {
			tok = reader.nextToken(state);
		} catch (EndOfStreamException e) {
			int position = reader.getPosition();
			if (!e.getFinalSpace().isEmpty()) {
				addPendingChars(e.getFinalSpace(), position);
				reader.moveToPosition(position + e.getFinalSpace().length());
			}
			flushPendingChars();
			return stopNodeListMet ? Status.STOP_NODE_LIST : Status.END_OF_STREAM;
		} catch (TokenParseException e) {
			Token recoveryToken = e.getRecoveryToken();
			addPendingChars(recoveryToken.getPreSpace(), recoveryToken.getStartIncludingPreSpace());
			return error(e, recoveryToken, e.getRecovery());
		}

		if (stopTokenCondition != null && stopTokenCondition.test(tok)) {
			addPendingChars(tok.getPreSpace(), tok.getStartIncludingPreSpace());
			flushPendingChars();
			stopToken = tok;
			return Status.STOP_TOKEN;
		}

		if (tok.getType() == TokenType.CHARS) {
			addPendingChars(tok.getPreSpace() + tok.getValue(), tok.getStartIncludingPreSpace());
			return Status.CONTINUE;
		}

		addPendingChars(tok.getPreSpace(), tok.getStartIncludingPreSpace());
		if (flushPendingChars()) {
			reader.moveToToken(tok, false);
			return Status.STOP_NODE_LIST;
		}

		switch (tok.getType()) {
			case COMMENT:
				if (walker.isKeepComments()) {
					return push(new CommentNode(tok.getSpan(), state, tok.getValue(), tok.getPostSpace()));
				}
				return Status.CONTINUE;
			case GROUP_CLOSE:
				return error(new NodesParseException("Unexpected mismatching closing delimiter ‘" + tok.getValue() +
						"’", tok.getStart(), state), tok, Recovery.pastToken(tok));
			case END_ENVIRONMENT:
				return error(new NodesParseException("Unexpected closing environment: ‘" + tok.getValue() + "’",
						tok.getStart(), state), tok, Recovery.pastToken(tok));
			case GROUP_OPEN:
				return readGroup(tok);
			case MATH_INLINE:
			case MATH_DISPLAY:
				return readMath(tok);
			case MACRO:
			case BEGIN_ENVIRONMENT:
			case SPECIALS:
				return readCall(tok);
			default:
				throw new InternalParserError("unhandled token type " + tok.getType());
		}
	}

	private ParsingState childState() {
		return childParsingState == null ? state : childParsingState.apply(state);
	}

	private Status readGroup(Token tok) throws LatexParseException {
		DelimiterPair pair = state.findGroupDelimiterPairByOpen(tok.getValue());
		reader.moveToToken(tok, false);
		LatexNode group = walker.parseContent(new DelimitedGroupParser(pair), reader, childState(), null).getValue();
		return pushIfPresent(group);
	}

	private Status readMath(Token tok) throws LatexParseException {
		if (state.isInMathMode()) {
			ParsingState.MathDelimiter expected = state.getExpectedClosingMathDelimiter();
			if (expected != null && expected.getDelimiter().equals(tok.getValue())) {
				return error(new NodesParseException("Unexpected closing math mode token ‘" + tok.getValue() + "’",
						tok.getStart(), state), tok, Recovery.pastToken(tok));
			}
			return error(new NodesParseException("Unexpected math mode delimiter ‘" + tok.getValue() +
					"’, already in math mode", tok.getStart(), state), tok, Recovery.pastToken(tok));
		}
		if (state.findMathDelimiterPair(tok.getValue()) == null) {
			return error(new NodesParseException("Unexpected closing math mode token ‘" + tok.getValue() + "’",
					tok.getStart(), state), tok, Recovery.pastToken(tok));
		}
		reader.moveToToken(tok, false);
		LatexNode math = walker.parseContent(new MathParser(tok.getValue()), reader, childState(), null).getValue();
		return pushIfPresent(math);
	}

	private Status readCall(Token tok) throws LatexParseException {
		CallableSpec spec;
		ConstructKind kind;
		try {
			switch (tok.getType()) {
				case MACRO:
					kind = ConstructKind.MACRO;
					spec = state.getContextDb().getMacroSpec(tok.getValue());
					break;
				case BEGIN_ENVIRONMENT:
					kind = ConstructKind.ENVIRONMENT;
					spec = state.getContextDb().getEnvironmentSpec(tok.getValue());
					break;
				case SPECIALS:
					kind = ConstructKind.SPECIALS;
					spec = tok.getSpecialsSpec() != null ? tok.getSpecialsSpec()
							: state.getContextDb().getSpecialsSpec(tok.getValue());
					break;
				default:
					throw new Unreachable();
			}
		} catch (UnknownConstructException e) {
			return error(new NodesParseException("Encountered " + e.getMessage(), tok.getStart(), state, e), tok,
					Recovery.pastToken(tok));
		}
		OpenContext context = new OpenContext(kind.getDescription() + " ‘" + kind.display(tok.getValue()) + "’",
				tok.getSpan());
		ParseResult.Success<? extends LatexNode> result = walker.parseContent(spec.getNodeParser(tok), reader,
				childState(), context);
		if (result.getCarryover().changesParsingState()) {
			state = result.getCarryover().getUpdatedParsingState(state, walker);
			carryover = CarryoverInfo.setParsingState(state);
		}
		return pushIfPresent(result.getValue());
	}

	private Status pushIfPresent(LatexNode node) {
		if (node == null) {
			return Status.CONTINUE;
		}
		return push(node);
	}

	private Status push(LatexNode node) {
		nodes.add(node);
		if (stopNodeListCondition != null && stopNodeListCondition.test(nodes)) {
			stopNodeListMet = true;
			return Status.STOP_NODE_LIST;
		}
		return Status.CONTINUE;
	}

	private void addPendingChars(String chars, int position) {
		if (chars.isEmpty()) {
			return;
		}
		if (pendingChars.length() == 0) {
			pendingCharsStart = position;
		}
		pendingChars.append(chars);
	}

	/**
	 * @return true if the flushed characters met the stop condition on the node list
	 */
	private boolean flushPendingChars() {
		if (pendingChars.length() == 0) {
			return false;
		}
		String chars = pendingChars.toString();
		pendingChars.setLength(0);
		CharsNode node = new CharsNode(new SourceSpan(pendingCharsStart, pendingCharsStart + chars.length()), state,
				chars);
		return push(node) == Status.STOP_NODE_LIST;
	}

	/**
	 * Whitespace in front of {@code offending} must already be pending or flushed.
	 */
	private Status error(LatexParseException e, Token offending, Recovery recovery) {
		if (!walker.isTolerantParsing()) {
			flushPendingChars();
			error = e;
			errorRecovery = recovery;
			return Status.ERROR;
		}
		walker.recordRecoveredError(e, recovery);
		flushPendingChars();
		recovery.apply(reader, state);
		if (reader.getPosition() < offending.getEnd()) {
			reader.moveToPosition(offending.getEnd());
		}
		return push(new ErrorNode(new SourceSpan(offending.getStart(), reader.getPosition()), state,
				e.getBaseMessage()));
	}

	// a nested parser that recovered without consuming anything would loop forever
	private Status noProgress(int position) {
		NodesParseException e = new NodesParseException("Could not make progress parsing at this position",
				position, state);
		if (!walker.isTolerantParsing()) {
			error = e;
			errorRecovery = Recovery.nextDelimiter(position + 1);
			return Status.ERROR;
		}
		Recovery recovery = Recovery.nextDelimiter(Integer.min(position + 1, state.getSource().length()));
		walker.recordRecoveredError(e, recovery);
		recovery.apply(reader, state);
		return push(new ErrorNode(new SourceSpan(position, reader.getPosition()), state, e.getBaseMessage()));
	}
}
