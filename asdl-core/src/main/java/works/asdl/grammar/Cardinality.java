package works.asdl.grammar;

/**
 * How many values a {@link Field} holds.
 */
public enum Cardinality {
	/**
	 * Exactly one value.
	 */
	SINGLE("", "single"),

	/**
	 * Zero or one value. Absence is represented by {@code null} in native nodes.
	 */
	OPTIONAL("?", "optional"),

	/**
	 * Zero or more values, in order.
	 */
	MULTIPLE("*", "multiple");

	private final String suffix;
	private final String description;

	Cardinality(String suffix, String description) {
		this.suffix = suffix;
		this.description = description;
	}

	/**
	 * @return the ASDL type suffix: empty, {@code ?} or {@code *}
	 */
	public String suffix() {
		return suffix;
	}

	public String description() {
		return description;
	}

	public boolean admits(int count) {
		return switch (this) {
			case SINGLE -> count == 1;
			case OPTIONAL -> count == 0 || count == 1;
			case MULTIPLE -> count >= 0;
		};
	}

	public static Cardinality fromSuffix(char suffix) {
		return switch (suffix) {
			case '?' -> OPTIONAL;
			case '*' -> MULTIPLE;
			default -> throw new IllegalArgumentException("Not a cardinality suffix: '" + suffix + "'");
		};
	}
}
