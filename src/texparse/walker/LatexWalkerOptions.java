package texparse.walker;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Configuration of a {@link LatexWalker}. Instances are immutable; the {@code with*} methods
 * return modified copies.
 */
public final class LatexWalkerOptions {
	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	private final boolean tolerantParsing;
	private final boolean keepComments;
	private final int maxNestingDepth;
	private final boolean doubleNewlineParagraphs;
	private final boolean macroArgumentsInExpressions;

	public LatexWalkerOptions() {
		this(true, true, DEFAULT_MAX_NESTING_DEPTH, true, false);
	}

	private LatexWalkerOptions(boolean tolerantParsing, boolean keepComments, int maxNestingDepth,
	                           boolean doubleNewlineParagraphs, boolean macroArgumentsInExpressions) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maximum nesting depth must be positive, got " + maxNestingDepth);
		}
		this.tolerantParsing = tolerantParsing;
		this.keepComments = keepComments;
		this.maxNestingDepth = maxNestingDepth;
		this.doubleNewlineParagraphs = doubleNewlineParagraphs;
		this.macroArgumentsInExpressions = macroArgumentsInExpressions;
	}

	/**
	 * Reads options from a JSON object. Missing keys keep their defaults.
	 *
	 * <pre>
	 * { "tolerantParsing": false, "keepComments": true, "maxNestingDepth": 100,
	 *   "doubleNewlineParagraphs": true, "macroArgumentsInExpressions": false }
	 * </pre>
	 */
	public static LatexWalkerOptions fromJson(JSONObject json) throws JSONException {
		LatexWalkerOptions defaults = new LatexWalkerOptions();
		return new LatexWalkerOptions(
				json.optBoolean("tolerantParsing", defaults.tolerantParsing),
				json.optBoolean("keepComments", defaults.keepComments),
				json.optInt("maxNestingDepth", defaults.maxNestingDepth),
				json.optBoolean("doubleNewlineParagraphs", defaults.doubleNewlineParagraphs),
				json.optBoolean("macroArgumentsInExpressions", defaults.macroArgumentsInExpressions));
	}

	public static LatexWalkerOptions fromJson(String json) throws JSONException {
		return fromJson(new JSONObject(json));
	}

	public boolean isTolerantParsing() {
		return tolerantParsing;
	}

	public boolean isKeepComments() {
		return keepComments;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	public boolean isDoubleNewlineParagraphs() {
		return doubleNewlineParagraphs;
	}

	/**
	 * Whether a macro read as a single-expression argument, as in {@code \frac\alpha\beta},
	 * reads its own arguments too. TeX does not, which is the default.
	 */
	public boolean isMacroArgumentsInExpressions() {
		return macroArgumentsInExpressions;
	}

	public LatexWalkerOptions withTolerantParsing(boolean tolerantParsing) {
		return new LatexWalkerOptions(tolerantParsing, keepComments, maxNestingDepth, doubleNewlineParagraphs,
				macroArgumentsInExpressions);
	}

	public LatexWalkerOptions withKeepComments(boolean keepComments) {
		return new LatexWalkerOptions(tolerantParsing, keepComments, maxNestingDepth, doubleNewlineParagraphs,
				macroArgumentsInExpressions);
	}

	public LatexWalkerOptions withMaxNestingDepth(int maxNestingDepth) {
		return new LatexWalkerOptions(tolerantParsing, keepComments, maxNestingDepth, doubleNewlineParagraphs,
				macroArgumentsInExpressions);
	}

	public LatexWalkerOptions withDoubleNewlineParagraphs(boolean doubleNewlineParagraphs) {
		return new LatexWalkerOptions(tolerantParsing, keepComments, maxNestingDepth, doubleNewlineParagraphs,
				macroArgumentsInExpressions);
	}

	public LatexWalkerOptions withMacroArgumentsInExpressions(boolean macroArgumentsInExpressions) {
		return new LatexWalkerOptions(tolerantParsing, keepComments, maxNestingDepth, doubleNewlineParagraphs,
				macroArgumentsInExpressions);
	}

	@Override
	public String toString() {
		return "LatexWalkerOptions [tolerantParsing=" + tolerantParsing + ", keepComments=" + keepComments +
				", maxNestingDepth=" + maxNestingDepth + ", doubleNewlineParagraphs=" + doubleNewlineParagraphs +
				", macroArgumentsInExpressions=" + macroArgumentsInExpressions + "]";
	}
}
