package texparse.model;

import texparse.context.ArgumentSpec;

import java.util.Collections;
import java.util.List;

public final class ParsedArgumentInfo {
	private final ArgumentSpec spec;
	private final LatexNode node;

	public ParsedArgumentInfo(ArgumentSpec spec, LatexNode node) {
		this.spec = spec;
		this.node = node;
	}

	public ArgumentSpec getSpec() {
		return spec;
	}

	public LatexNode getNode() {
		return node;
	}

	public boolean wasProvided() {
		return node != null;
	}

	/**
	 * @return the contents of a group argument, the argument itself if it is not a group, or an
	 * empty list if it was not provided
	 */
	public List<LatexNode> getContentNodes() {
		if (node == null) {
			return Collections.emptyList();
		}
		if (node instanceof GroupNode) {
			return ((GroupNode) node).getNodes().getNodes();
		}
		return Collections.singletonList(node);
	}

	/**
	 * @return the argument's plain-character content, or null if it was not provided
	 */
	public String getContentAsChars() {
		if (node == null) {
			return null;
		}
		if (node instanceof GroupNode) {
			return ((GroupNode) node).getNodes().getContentAsChars();
		}
		return LatexNodeList.of(Collections.singletonList(node), node.getStart(), node.getParsingState())
				.getContentAsChars();
	}
}
