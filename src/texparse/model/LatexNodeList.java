package texparse.model;

import texparse.state.ParsingState;
import texparse.util.SourceSpan;
import texparse.util.SourceSpanned;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * An ordered, immutable sequence of sibling nodes, together with the span they cover.
 */
public final class LatexNodeList implements Iterable<LatexNode>, SourceSpanned {
	private final List<LatexNode> nodes;
	private final SourceSpan span;
	private final ParsingState parsingState;

	public LatexNodeList(List<? extends LatexNode> nodes, SourceSpan span, ParsingState parsingState) {
		this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
		this.span = span;
		this.parsingState = parsingState;
	}

	/**
	 * Builds a node list whose span runs from its first to its last node, or is empty at
	 * {@code emptyPosition} if there are no nodes.
	 */
	public static LatexNodeList of(List<? extends LatexNode> nodes, int emptyPosition, ParsingState parsingState) {
		if (nodes.isEmpty()) {
			return new LatexNodeList(nodes, SourceSpan.empty(emptyPosition), parsingState);
		}
		SourceSpan span = new SourceSpan(nodes.get(0).getStart(), nodes.get(nodes.size() - 1).getEnd());
		return new LatexNodeList(nodes, span, parsingState);
	}

	@Override
	public SourceSpan getSpan() {
		return span;
	}

	public ParsingState getParsingState() {
		return parsingState;
	}

	public List<LatexNode> getNodes() {
		return nodes;
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public LatexNode get(int index) {
		return nodes.get(index);
	}

	public LatexNodeList subList(int fromIndex, int toIndex) {
		int emptyPosition = fromIndex < nodes.size() ? nodes.get(fromIndex).getStart() : span.getEnd();
		return of(nodes.subList(fromIndex, toIndex), emptyPosition, parsingState);
	}

	@Override
	public Iterator<LatexNode> iterator() {
		return nodes.iterator();
	}

	public List<LatexNode> filter(Predicate<? super LatexNode> keep) {
		List<LatexNode> result = new ArrayList<>();
		for (LatexNode node : nodes) {
			if (keep.test(node)) {
				result.add(node);
			}
		}
		return result;
	}

	/**
	 * @return the nodes that are neither comments nor whitespace-only chars
	 */
	public List<LatexNode> filterOutWhitespaceAndComments() {
		return filter(n -> !(n instanceof CommentNode) && !(n instanceof CharsNode && ((CharsNode) n).isWhitespace()));
	}

	/**
	 * Splits this list at every node matching the separator predicate. Separator nodes are not
	 * part of the result.
	 */
	public List<LatexNodeList> splitAtNode(Predicate<? super LatexNode> isSeparator) {
		List<LatexNodeList> parts = new ArrayList<>();
		List<LatexNode> current = new ArrayList<>();
		int partStart = span.getStart();
		for (LatexNode node : nodes) {
			if (isSeparator.test(node)) {
				parts.add(of(current, partStart, parsingState));
				current = new ArrayList<>();
				partStart = node.getEnd();
			} else {
				current.add(node);
			}
		}
		parts.add(of(current, partStart, parsingState));
		return parts;
	}

	/**
	 * Splits this list at every occurrence of {@code separator} inside chars nodes. Chars nodes
	 * are cut into pieces with adjusted spans; other nodes are kept whole.
	 */
	public List<LatexNodeList> splitAtChars(String separator, boolean keepEmptyParts) {
		if (separator.isEmpty()) {
			throw new IllegalArgumentException("separator must not be empty");
		}
		List<LatexNodeList> parts = new ArrayList<>();
		List<LatexNode> current = new ArrayList<>();
		int partStart = span.getStart();
		for (LatexNode node : nodes) {
			if (!(node instanceof CharsNode)) {
				current.add(node);
				continue;
			}
			CharsNode chars = (CharsNode) node;
			String text = chars.getChars();
			int pieceStart = 0;
			int found = text.indexOf(separator);
			while (found != -1) {
				addCharsPiece(current, chars, pieceStart, found);
				addPart(parts, current, partStart, keepEmptyParts);
				current = new ArrayList<>();
				pieceStart = found + separator.length();
				partStart = chars.getStart() + pieceStart;
				found = text.indexOf(separator, pieceStart);
			}
			addCharsPiece(current, chars, pieceStart, text.length());
		}
		addPart(parts, current, partStart, keepEmptyParts);
		return parts;
	}

	private static void addCharsPiece(List<LatexNode> current, CharsNode chars, int from, int to) {
		if (from == 0 && to == chars.getChars().length()) {
			current.add(chars);
		} else if (from < to) {
			current.add(new CharsNode(new SourceSpan(chars.getStart() + from, chars.getStart() + to),
					chars.getParsingState(), chars.getChars().substring(from, to)));
		}
	}

	private void addPart(List<LatexNodeList> parts, List<LatexNode> current, int partStart, boolean keepEmpty) {
		if (keepEmpty || !current.isEmpty()) {
			parts.add(of(current, partStart, parsingState));
		}
	}

	/**
	 * @return the text of the chars and specials in this list, descending into groups; other
	 * constructs contribute nothing
	 */
	public String getContentAsChars() {
		StringBuilder sb = new StringBuilder();
		ContentAsCharsVisitor visitor = new ContentAsCharsVisitor(sb);
		for (LatexNode node : nodes) {
			node.accept(visitor);
		}
		return sb.toString();
	}

	public String getLatexVerbatim() {
		return span.substring(parsingState.getSource());
	}

	/**
	 * @return every node in this list and, recursively, every node nested in it (arguments,
	 * bodies, group contents), in document order
	 */
	public List<LatexNode> descendants() {
		List<LatexNode> result = new ArrayList<>();
		ChildNodesVisitor children = new ChildNodesVisitor();
		Deque<LatexNode> stack = new ArrayDeque<>();
		for (int i = nodes.size() - 1; i >= 0; --i) {
			stack.push(nodes.get(i));
		}
		while (!stack.isEmpty()) {
			LatexNode node = stack.pop();
			result.add(node);
			List<LatexNode> nested = node.accept(children);
			for (int i = nested.size() - 1; i >= 0; --i) {
				stack.push(nested.get(i));
			}
		}
		return result;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + nodes.hashCode();
		result = prime * result + span.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		LatexNodeList other = (LatexNodeList) obj;
		return nodes.equals(other.nodes) && span.equals(other.span);
	}

	@Override
	public String toString() {
		return "LatexNodeList " + span + " " + nodes;
	}

	private static class ContentAsCharsVisitor extends LatexNodeVisitor<Void, RuntimeException> {
		private final StringBuilder sb;

		ContentAsCharsVisitor(StringBuilder sb) {
			this.sb = sb;
		}

		@Override
		public Void visit(CharsNode charsNode) {
			sb.append(charsNode.getChars());
			return null;
		}

		@Override
		public Void visit(GroupNode groupNode) {
			for (LatexNode node : groupNode.getNodes()) {
				node.accept(this);
			}
			return null;
		}

		@Override
		public Void visit(CommentNode commentNode) {
			return null;
		}

		@Override
		public Void visit(MacroNode macroNode) {
			return null;
		}

		@Override
		public Void visit(EnvironmentNode environmentNode) {
			return null;
		}

		@Override
		public Void visit(SpecialsNode specialsNode) {
			sb.append(specialsNode.getSpecialsChars());
			return null;
		}

		@Override
		public Void visit(MathNode mathNode) {
			return null;
		}

		@Override
		public Void visit(ErrorNode errorNode) {
			return null;
		}
	}
}
