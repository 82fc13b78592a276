package works.asdl.exceptions;

/**
 * No production with the given constructor name exists,
 * either in the grammar or among the registered native node types.
 */
public final class UnknownProductionException extends AsdlFormatException {
	private final String constructorName;

	public UnknownProductionException(String constructorName) {
		super("Unknown production: " + constructorName);
		this.constructorName = constructorName;
	}

	public UnknownProductionException(String constructorName, String message) {
		super(message);
		this.constructorName = constructorName;
	}

	UnknownProductionException(String constructorName, String message, Throwable cause) {
		super(message, cause);
		this.constructorName = constructorName;
	}

	public String constructorName() {
		return constructorName;
	}
}
