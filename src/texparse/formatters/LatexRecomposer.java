package texparse.formatters;

import texparse.Unreachable;
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
import texparse.state.ParsingState;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Writes LaTeX text back from a node tree. Whitespace that the tree does not hold as nodes,
 * such as the space between a macro's arguments, is copied from the parsed source, so that
 * recomposing a freshly parsed tree reproduces its source.
 */
public class LatexRecomposer extends LatexNodeVisitor<Void, IOException> {
	private final Writer out;

	public LatexRecomposer(Writer out) {
		this.out = out;
	}

	public static String recompose(LatexNodeList nodes) {
		StringWriter out = new StringWriter();
		try {
			new LatexRecomposer(out).writeNodes(nodes);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public static String recompose(LatexNode node) {
		StringWriter out = new StringWriter();
		try {
			node.accept(new LatexRecomposer(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public void writeNodes(LatexNodeList nodes) throws IOException {
		for (LatexNode node : nodes) {
			node.accept(this);
		}
	}

	private void writeGap(ParsingState state, int from, int to) throws IOException {
		if (to > from) {
			out.write(state.getSource(), from, to - from);
		}
	}

	/**
	 * Writes the arguments of a call whose head ends at {@code position}.
	 *
	 * @return the position after the last argument
	 */
	private int writeArguments(ParsingState state, ParsedArguments arguments, int position) throws IOException {
		int pos = position;
		for (LatexNode argument : arguments.getProvidedArguments()) {
			writeGap(state, pos, argument.getStart());
			argument.accept(this);
			pos = Integer.max(pos, argument.getEnd());
		}
		return pos;
	}

	@Override
	public Void visit(CharsNode charsNode) throws IOException {
		out.write(charsNode.getChars());
		return null;
	}

	@Override
	public Void visit(GroupNode groupNode) throws IOException {
		out.write(groupNode.getDelimiters().getOpen());
		writeNodes(groupNode.getNodes());
		if (!groupNode.isIncomplete()) {
			out.write(groupNode.getDelimiters().getClose());
		}
		return null;
	}

	@Override
	public Void visit(CommentNode commentNode) throws IOException {
		out.write(commentNode.getParsingState().getCommentStart());
		out.write(commentNode.getComment());
		out.write(commentNode.getPostSpace());
		return null;
	}

	@Override
	public Void visit(MacroNode macroNode) throws IOException {
		ParsingState state = macroNode.getParsingState();
		String head = state.getMacroEscapeChar() + macroNode.getName() + macroNode.getPostSpace();
		out.write(head);
		int pos = writeArguments(state, macroNode.getArguments(), macroNode.getStart() + head.length());
		writeGap(state, pos, macroNode.getEnd());
		return null;
	}

	@Override
	public Void visit(EnvironmentNode environmentNode) throws IOException {
		ParsingState state = environmentNode.getParsingState();
		String source = state.getSource();
		// the \begin{name} token, as written
		int headEnd = source.indexOf('}', environmentNode.getStart()) + 1;
		writeGap(state, environmentNode.getStart(), headEnd);
		int pos = writeArguments(state, environmentNode.getArguments(), headEnd);
		LatexNodeList body = environmentNode.getBody();
		if (!body.isEmpty()) {
			writeGap(state, pos, body.getStart());
			writeNodes(body);
			pos = body.getEnd();
		}
		if (!environmentNode.isIncomplete()) {
			writeGap(state, pos, environmentNode.getEnd());
		}
		return null;
	}

	@Override
	public Void visit(SpecialsNode specialsNode) throws IOException {
		ParsingState state = specialsNode.getParsingState();
		out.write(specialsNode.getLatexVerbatim().substring(0, specialsHeadLength(specialsNode)));
		int pos = writeArguments(state, specialsNode.getArguments(),
				specialsNode.getStart() + specialsHeadLength(specialsNode));
		writeGap(state, pos, specialsNode.getEnd());
		return null;
	}

	// a paragraph break is a specials whose source may hold more than its two newlines
	private static int specialsHeadLength(SpecialsNode specialsNode) {
		if (specialsNode.getArguments().getProvidedArguments().isEmpty()) {
			return specialsNode.getSpan().length();
		}
		return specialsNode.getSpecialsChars().length();
	}

	@Override
	public Void visit(MathNode mathNode) throws IOException {
		out.write(mathNode.getDelimiters().getOpen());
		writeNodes(mathNode.getNodes());
		if (!mathNode.isIncomplete()) {
			out.write(mathNode.getDelimiters().getClose());
		}
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) throws IOException {
		out.write(errorNode.getLatexVerbatim());
		return null;
	}
}
