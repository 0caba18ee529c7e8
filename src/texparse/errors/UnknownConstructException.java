package texparse.errors;

import texparse.context.ConstructKind;

/**
 * Raised by a context database lookup when no spec is registered under a name and no fallback
 * spec is configured for that kind of construct.
 */
@SuppressWarnings("serial")
public class UnknownConstructException extends LatexWalkerException {
	private final ConstructKind kind;
	private final String name;

	public UnknownConstructException(ConstructKind kind, String name) {
		super("Unknown " + kind.getDescription() + " ‘" + kind.display(name) + "’");
		this.kind = kind;
		this.name = name;
	}

	public ConstructKind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}
}
