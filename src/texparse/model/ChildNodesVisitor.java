package texparse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists the nodes directly nested in a node: provided arguments first, then contents or body.
 */
public class ChildNodesVisitor extends LatexNodeVisitor<List<LatexNode>, RuntimeException> {

	@Override
	public List<LatexNode> visit(CharsNode charsNode) {
		return Collections.emptyList();
	}

	@Override
	public List<LatexNode> visit(GroupNode groupNode) {
		return groupNode.getNodes().getNodes();
	}

	@Override
	public List<LatexNode> visit(CommentNode commentNode) {
		return Collections.emptyList();
	}

	@Override
	public List<LatexNode> visit(MacroNode macroNode) {
		return macroNode.getArguments().getProvidedArguments();
	}

	@Override
	public List<LatexNode> visit(EnvironmentNode environmentNode) {
		List<LatexNode> children = new ArrayList<>(environmentNode.getArguments().getProvidedArguments());
		children.addAll(environmentNode.getBody().getNodes());
		return children;
	}

	@Override
	public List<LatexNode> visit(SpecialsNode specialsNode) {
		return specialsNode.getArguments().getProvidedArguments();
	}

	@Override
	public List<LatexNode> visit(MathNode mathNode) {
		return mathNode.getNodes().getNodes();
	}

	@Override
	public List<LatexNode> visit(ErrorNode errorNode) {
		return Collections.emptyList();
	}
}
