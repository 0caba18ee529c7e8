package texparse.model;

import texparse.context.ArgumentSpec;
import texparse.util.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The arguments of a macro, environment or specials call, in declared order. An argument that
 * was optional and absent is recorded as null.
 */
public final class ParsedArguments {
	private final List<ArgumentSpec> argumentSpecs;
	private final List<LatexNode> arguments;
	private final SourceSpan span;

	public ParsedArguments(List<ArgumentSpec> argumentSpecs, List<LatexNode> arguments, SourceSpan span) {
		if (argumentSpecs.size() != arguments.size()) {
			throw new IllegalArgumentException("expected " + argumentSpecs.size() + " arguments, got " +
					arguments.size());
		}
		this.argumentSpecs = Collections.unmodifiableList(new ArrayList<>(argumentSpecs));
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		this.span = span;
	}

	public static ParsedArguments empty(int position) {
		return new ParsedArguments(Collections.emptyList(), Collections.emptyList(), SourceSpan.empty(position));
	}

	public List<ArgumentSpec> getArgumentSpecs() {
		return argumentSpecs;
	}

	public List<LatexNode> getArguments() {
		return arguments;
	}

	public List<LatexNode> getProvidedArguments() {
		List<LatexNode> provided = new ArrayList<>();
		for (LatexNode argument : arguments) {
			if (argument != null) {
				provided.add(argument);
			}
		}
		return provided;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public int size() {
		return arguments.size();
	}

	public LatexNode getArgument(int index) {
		return arguments.get(index);
	}

	public LatexNode getArgument(String name) {
		return arguments.get(indexOf(name));
	}

	public ParsedArgumentInfo getArgumentInfo(int index) {
		return new ParsedArgumentInfo(argumentSpecs.get(index), arguments.get(index));
	}

	public ParsedArgumentInfo getArgumentInfo(String name) {
		return getArgumentInfo(indexOf(name));
	}

	private int indexOf(String name) {
		for (int i = 0; i < argumentSpecs.size(); ++i) {
			if (name.equals(argumentSpecs.get(i).getName())) {
				return i;
			}
		}
		throw new IllegalArgumentException("no argument named ‘" + name + "’");
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + arguments.hashCode();
		result = prime * result + span.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ParsedArguments other = (ParsedArguments) obj;
		return arguments.equals(other.arguments) && span.equals(other.span);
	}

	@Override
	public String toString() {
		return "ParsedArguments " + span + " " + arguments;
	}
}
