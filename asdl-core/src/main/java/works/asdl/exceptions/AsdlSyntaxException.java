package works.asdl.exceptions;

/**
 * ASDL grammar text could not be parsed.
 */
public final class AsdlSyntaxException extends AsdlFormatException {
	private final int lineNumber;

	public AsdlSyntaxException(int lineNumber, String message) {
		super("Line " + lineNumber + ": " + message);
		this.lineNumber = lineNumber;
	}

	public AsdlSyntaxException(int lineNumber, String message, Throwable cause) {
		super("Line " + lineNumber + ": " + message, cause);
		this.lineNumber = lineNumber;
	}

	AsdlSyntaxException(String fullMessage, int lineNumber, Throwable cause) {
		super(fullMessage, cause);
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based line where the problem was detected
	 */
	public int lineNumber() {
		return lineNumber;
	}
}
