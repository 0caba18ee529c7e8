package texparse.context;

public enum ConstructKind {
	MACRO("macro"),
	ENVIRONMENT("environment"),
	SPECIALS("specials");

	private final String description;

	ConstructKind(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

	public String display(String name) {
		switch (this) {
			case MACRO:
				return "\\" + name;
			case ENVIRONMENT:
				return "{" + name + "}";
			default:
				return name;
		}
	}
}
