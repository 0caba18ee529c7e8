package texparse.formatters;

import texparse.model.CharsNode;
import texparse.model.CommentNode;
import texparse.model.EnvironmentNode;
import texparse.model.ErrorNode;
import texparse.model.GroupNode;
import texparse.model.LatexNode;
import texparse.model.LatexNodeList;
import texparse.model.LatexNodeVisitor;
import texparse.model.MacroNode;
import texparse.model.MathNode;
import texparse.model.ParsedArguments;
import texparse.model.SpecialsNode;

import java.io.IOException;

/**
 * Writes a node tree as an indented outline, for debugging.
 */
public class NodeFormattingVisitor extends LatexNodeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public NodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private static String quote(String s) {
		return "\"" + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t").replace("\"", "\\\"") + "\"";
	}

	private void writeNodes(LatexNodeList nodes) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (LatexNode node : nodes) {
				out.newLine();
				node.accept(this);
			}
		}
	}

	private void writeArguments(ParsedArguments arguments) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (int i = 0; i < arguments.size(); ++i) {
				out.newLine();
				out.write("#" + (i + 1) + ": ");
				LatexNode argument = arguments.getArgument(i);
				if (argument == null) {
					out.write("(absent)");
				} else {
					argument.accept(this);
				}
			}
		}
	}

	@Override
	public Void visit(CharsNode charsNode) throws IOException {
		out.write("Chars " + charsNode.getSpan() + " " + quote(charsNode.getChars()));
		return null;
	}

	@Override
	public Void visit(GroupNode groupNode) throws IOException {
		out.write("Group " + groupNode.getSpan() + " " + quote(groupNode.getDelimiters().getOpen()) + " " +
				quote(groupNode.getDelimiters().getClose()));
		if (groupNode.isIncomplete()) {
			out.write(" (incomplete)");
		}
		writeNodes(groupNode.getNodes());
		return null;
	}

	@Override
	public Void visit(CommentNode commentNode) throws IOException {
		out.write("Comment " + commentNode.getSpan() + " " + quote(commentNode.getComment()));
		return null;
	}

	@Override
	public Void visit(MacroNode macroNode) throws IOException {
		out.write("Macro " + macroNode.getSpan() + " \\" + macroNode.getName());
		writeArguments(macroNode.getArguments());
		return null;
	}

	@Override
	public Void visit(EnvironmentNode environmentNode) throws IOException {
		out.write("Environment " + environmentNode.getSpan() + " {" + environmentNode.getName() + "}");
		if (environmentNode.isIncomplete()) {
			out.write(" (incomplete)");
		}
		writeArguments(environmentNode.getArguments());
		writeNodes(environmentNode.getBody());
		return null;
	}

	@Override
	public Void visit(SpecialsNode specialsNode) throws IOException {
		out.write("Specials " + specialsNode.getSpan() + " " + quote(specialsNode.getSpecialsChars()));
		writeArguments(specialsNode.getArguments());
		return null;
	}

	@Override
	public Void visit(MathNode mathNode) throws IOException {
		out.write("Math " + mathNode.getSpan() + " " + mathNode.getDisplayType() + " " +
				quote(mathNode.getDelimiters().getOpen()));
		if (mathNode.isIncomplete()) {
			out.write(" (incomplete)");
		}
		writeNodes(mathNode.getNodes());
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) throws IOException {
		out.write("Error " + errorNode.getSpan() + " " + quote(errorNode.getMessage()));
		return null;
	}
}
