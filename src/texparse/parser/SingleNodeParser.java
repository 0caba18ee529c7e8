package texparse.parser;

import texparse.model.CharsNode;
import texparse.model.CommentNode;
import texparse.model.LatexNode;

import java.util.List;

/**
 * Parses up to and including the first node that is neither whitespace nor, unless asked for,
 * a comment. The result also holds the skipped whitespace and comments, and holds no such node
 * at all if the input ended first.
 */
public class SingleNodeParser extends GeneralNodesParser {

	public SingleNodeParser() {
		this(false);
	}

	public SingleNodeParser(boolean stopOnComment) {
		super(null, nodes -> containsSignificantNode(nodes, stopOnComment), false, null);
	}

	private static boolean containsSignificantNode(List<LatexNode> nodes, boolean stopOnComment) {
		for (LatexNode node : nodes) {
			if (node instanceof CharsNode && ((CharsNode) node).isWhitespace()) {
				continue;
			}
			if (node instanceof CommentNode && !stopOnComment) {
				continue;
			}
			return true;
		}
		return false;
	}
}
