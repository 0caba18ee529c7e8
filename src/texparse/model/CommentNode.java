package texparse.model;

import texparse.state.ParsingState;
import texparse.util.SourceSpan;

import java.util.Objects;

public class CommentNode extends LatexNode {
	private final String comment;
	private final String postSpace;

	public CommentNode(SourceSpan span, ParsingState parsingState, String comment, String postSpace) {
		super(span, parsingState);
		this.comment = comment;
		this.postSpace = postSpace;
	}

	/**
	 * @return the comment text, without the comment start and without the newline
	 */
	public String getComment() {
		return comment;
	}

	public String getPostSpace() {
		return postSpace;
	}

	@Override
	public <T, E extends Throwable> T accept(LatexNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSpan(), comment, postSpace);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		CommentNode other = (CommentNode) obj;
		return getSpan().equals(other.getSpan()) && comment.equals(other.comment) &&
				postSpace.equals(other.postSpace);
	}
}
