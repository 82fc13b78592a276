package works.asdl.exceptions;

/**
 * A tree is shaped in a way its grammar does not allow,
 * such as a token where a subtree belongs, or realized fields
 * that do not line up with the production's fields.
 */
public final class MalformedTreeException extends AsdlFormatException {
	public MalformedTreeException(String message) {
		super(message);
	}

	public MalformedTreeException(String message, Throwable cause) {
		super(message, cause);
	}
}
