package works.asdl.exceptions;

/**
 * Root of every error raised while reading grammars or converting trees.
 * <p>
 * All subtypes are unchecked: a failed conversion is aborted as a whole
 * and nothing partial is ever returned.
 */
public sealed abstract class AsdlException extends RuntimeException permits
	AsdlFormatException,
	CardinalityViolationException,
	InvalidNodeTypeException
{
	protected AsdlException(String message) {
		super(message);
	}

	protected AsdlException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception}
	 * whose message is prefixed by {@code context},
	 * with {@code exception} as its cause.
	 * Used to record where in a tree a conversion failed.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends AsdlException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		AsdlException result;
		if (exception instanceof UnknownProductionException e) {
			result = new UnknownProductionException(e.constructorName(), newMessage, e);
		} else if (exception instanceof UnknownTerminalException e) {
			result = new UnknownTerminalException(e.fieldType(), e.value(), newMessage, e);
		} else if (exception instanceof MalformedTreeException e) {
			result = new MalformedTreeException(newMessage, e);
		} else if (exception instanceof AsdlSyntaxException e) {
			result = new AsdlSyntaxException(newMessage, e.lineNumber(), e);
		} else if (exception instanceof CardinalityViolationException e) {
			result = new CardinalityViolationException(e.constructorName(), e.fieldName(), e.actualCount(), newMessage, e);
		} else if (exception instanceof InvalidNodeTypeException e) {
			result = new InvalidNodeTypeException(newMessage, e);
		} else {
			throw new IllegalStateException("Unexpected exception type " + exception.getClass(), exception);
		}
		return (T) result;
	}
}
