package texparse.walker;

import texparse.context.LatexContextDb;
import texparse.context.StandardContext;
import texparse.errors.LatexParseException;
import texparse.errors.NestingDepthExceededException;
import texparse.errors.OpenContext;
import texparse.errors.RecoveredParseIssue;
import texparse.errors.TopLevelIssueContext;
import texparse.errors.UnknownConstructException;
import texparse.errors.UnknownConstructIssue;
import texparse.formatters.ErrorFormatter;
import texparse.lexer.LatexTokenReader;
import texparse.lexer.Token;
import texparse.lexer.TokenReader;
import texparse.model.LatexNodeList;
import texparse.parser.GeneralNodesParser;
import texparse.parser.LatexParser;
import texparse.parser.ParseResult;
import texparse.parser.Recovery;
import texparse.state.ObserverEvent;
import texparse.state.ParsingState;
import texparse.state.ParsingStateEventHandler;
import texparse.state.ParsingStateListener;
import texparse.util.LineIndex;
import texparse.util.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parses one LaTeX source string against a context database.
 *
 * <p>The walker owns the tolerant-parsing policy. Construct parsers report failures as
 * {@link ParseResult.Failure} values; {@link #parseContent} either throws the failure's error
 * (non-tolerant mode) or records it as an issue, performs the failure's recovery on the token
 * reader, and hands back the recovery value (tolerant mode).</p>
 *
 * <p>A walker is not thread-safe, but any number of walkers may share one frozen context
 * database.</p>
 */
public class LatexWalker implements ParsingStateEventHandler {

	private static final Logger logger = Logger.getLogger("TeXParse Walker");

	private final String source;
	private final LatexContextDb contextDb;
	private final LatexWalkerOptions options;
	private final ParsingState initialParsingState;
	private final LineIndex lineIndex;
	private final List<ParsingStateListener> listeners = new ArrayList<>();
	private ParsingStateEventHandler eventHandler = ParsingStateEventHandler.DEFAULT;
	private TopLevelIssueContext issues = new TopLevelIssueContext();
	private int depth = 0;

	public LatexWalker(String source, LatexContextDb contextDb, LatexWalkerOptions options) {
		this.source = source;
		this.contextDb = contextDb;
		this.options = options;
		contextDb.freeze();
		this.initialParsingState = ParsingState.builder(source, contextDb)
				.setEnableDoubleNewlineParagraphs(options.isDoubleNewlineParagraphs())
				.build();
		this.lineIndex = new LineIndex(source);
	}

	public LatexWalker(String source, LatexContextDb contextDb) {
		this(source, contextDb, new LatexWalkerOptions());
	}

	/**
	 * A walker over the bundled standard context database.
	 */
	public static LatexWalker withStandardContext(String source, LatexWalkerOptions options) {
		return new LatexWalker(source, StandardContext.getDefault(), options);
	}

	public String getSource() {
		return source;
	}

	public LatexContextDb getContextDb() {
		return contextDb;
	}

	public LatexWalkerOptions getOptions() {
		return options;
	}

	public boolean isTolerantParsing() {
		return options.isTolerantParsing();
	}

	public boolean isKeepComments() {
		return options.isKeepComments();
	}

	public ParsingState getInitialParsingState() {
		return initialParsingState;
	}

	public TokenReader makeTokenReader(int position) {
		return new LatexTokenReader(source, position);
	}

	public void setEventHandler(ParsingStateEventHandler eventHandler) {
		this.eventHandler = eventHandler;
	}

	public void addParsingStateListener(ParsingStateListener listener) {
		listeners.add(listener);
	}

	/**
	 * Parses the whole source into a node list.
	 */
	public ParseOutcome<LatexNodeList> parse() throws LatexParseException {
		return parseFrom(0);
	}

	/**
	 * Parses from {@code offset} to the end of the source, e.g. to re-parse the tail of a document
	 * after an edit.
	 */
	public ParseOutcome<LatexNodeList> parseFrom(int offset) throws LatexParseException {
		return parse(new GeneralNodesParser(), offset, initialParsingState);
	}

	/**
	 * Runs an arbitrary parser starting at {@code offset}.
	 */
	public <T> ParseOutcome<T> parse(LatexParser<T> parser, int offset, ParsingState parsingState)
			throws LatexParseException {
		issues = new TopLevelIssueContext();
		depth = 0;
		TokenReader reader = makeTokenReader(offset);
		try {
			ParseResult.Success<T> result = parseContent(parser, reader, parsingState, null);
			return new ParseOutcome<>(result.getValue(), result.getCarryover(), reader.getPosition(),
					issues.getIssues());
		} catch (LatexParseException e) {
			locate(e);
			throw e;
		}
	}

	/**
	 * Runs a nested parser. Failures are thrown when parsing strictly, and recovered from
	 * otherwise. Exceeding the nesting depth limit always throws.
	 *
	 * @param openContext describes the construct being parsed, for error messages; may be null
	 */
	public <T> ParseResult.Success<T> parseContent(LatexParser<T> parser, TokenReader reader,
	                                                ParsingState parsingState, OpenContext openContext)
			throws LatexParseException {
		if (depth >= options.getMaxNestingDepth()) {
			throw new NestingDepthExceededException(options.getMaxNestingDepth(), reader.getPosition(),
					parsingState);
		}
		ParseResult<T> result;
		depth++;
		try {
			result = parser.parse(this, reader, parsingState);
		} catch (LatexParseException e) {
			if (openContext != null) {
				e.addOpenContext(openContext);
			}
			throw e;
		} finally {
			depth--;
		}
		if (result.isSuccess()) {
			return (ParseResult.Success<T>) result;
		}
		ParseResult.Failure<T> failure = (ParseResult.Failure<T>) result;
		LatexParseException error = failure.getError();
		if (openContext != null) {
			error.addOpenContext(openContext);
		}
		if (!options.isTolerantParsing()) {
			throw error;
		}
		recordRecoveredError(error, failure.getRecovery());
		failure.getRecovery().apply(reader, parsingState);
		return ParseResult.success(failure.getValue(), failure.getCarryover());
	}

	/**
	 * Records an error that tolerant parsing recovered from.
	 */
	public void recordRecoveredError(LatexParseException error, Recovery recovery) {
		locate(error);
		logger.fine("ignoring parse error (tolerant parsing mode): " + error.getMessage());
		if (error.getCause() instanceof UnknownConstructException) {
			issues.error(new UnknownConstructIssue((UnknownConstructException) error.getCause(),
					error.getLocation()));
		} else {
			issues.error(new RecoveredParseIssue(error, error.getLocation(), recovery));
		}
	}

	public void locate(LatexParseException error) {
		if (error.getLocation() == null) {
			int position = Integer.max(0, Integer.min(error.getPosition(), source.length()));
			error.setLocation(lineIndex.locate(SourceSpan.empty(position)));
		}
	}

	public String formatError(LatexParseException error) {
		return new ErrorFormatter(source).format(error);
	}

	public LineIndex getLineIndex() {
		return lineIndex;
	}

	@Override
	public ParsingState enterMathMode(ParsingState state, String delimiter, Token trigger) {
		return eventHandler.enterMathMode(state, delimiter, trigger);
	}

	@Override
	public ParsingState leaveMathMode(ParsingState state, Token trigger) {
		return eventHandler.leaveMathMode(state, trigger);
	}

	@Override
	public void observe(ObserverEvent event, ParsingState state) {
		eventHandler.observe(event, state);
		for (ParsingStateListener listener : listeners) {
			listener.parsingStateEvent(event, state);
		}
	}
}
