package works.asdl.exceptions;

/**
 * The input does not conform to the grammar or to the terminal tables.
 * <p>
 * Unlike {@link CardinalityViolationException}, this describes ordinary bad input
 * that a caller might reasonably want to skip or report.
 */
public sealed abstract class AsdlFormatException extends AsdlException permits
	AsdlSyntaxException,
	MalformedTreeException,
	UnknownProductionException,
	UnknownTerminalException
{
	protected AsdlFormatException(String message) {
		super(message);
	}

	protected AsdlFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
