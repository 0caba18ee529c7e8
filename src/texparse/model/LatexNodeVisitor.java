package texparse.model;

public abstract class LatexNodeVisitor<T, E extends Throwable> {
	public abstract T visit(CharsNode charsNode) throws E;
	public abstract T visit(GroupNode groupNode) throws E;
	public abstract T visit(CommentNode commentNode) throws E;
	public abstract T visit(MacroNode macroNode) throws E;
	public abstract T visit(EnvironmentNode environmentNode) throws E;
	public abstract T visit(SpecialsNode specialsNode) throws E;
	public abstract T visit(MathNode mathNode) throws E;
	public abstract T visit(ErrorNode errorNode) throws E;
}
