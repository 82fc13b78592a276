package works.asdl.exceptions;

/**
 * A terminal table has no entry for a value.
 * The value is a native token when encoding, and a constructor name when decoding.
 */
public final class UnknownTerminalException extends AsdlFormatException {
	private final String fieldType;
	private final String value;

	public UnknownTerminalException(String fieldType, String value, String message) {
		super(message);
		this.fieldType = fieldType;
		this.value = value;
	}

	UnknownTerminalException(String fieldType, String value, String message, Throwable cause) {
		super(message, cause);
		this.fieldType = fieldType;
		this.value = value;
	}

	public static UnknownTerminalException unknownToken(String fieldType, String token) {
		return new UnknownTerminalException(fieldType, token,
			"No " + fieldType + " constructor for token \"" + token + "\"");
	}

	public static UnknownTerminalException unknownConstructor(String fieldType, String constructorName) {
		return new UnknownTerminalException(fieldType, constructorName,
			"No " + fieldType + " token for constructor " + constructorName);
	}

	public String fieldType() {
		return fieldType;
	}

	public String value() {
		return value;
	}
}
