package works.asdl.exceptions;

/**
 * A native node type cannot be used with a grammar:
 * it is not a record, its components do not match the production's fields,
 * or a composite production has no native node type at all.
 * <p>
 * Raised while a converter is being built, never during conversion.
 */
public final class InvalidNodeTypeException extends AsdlException {
	public InvalidNodeTypeException(String message) {
		super(message);
	}

	public InvalidNodeTypeException(String message, Throwable cause) {
		super(message, cause);
	}

	public static InvalidNodeTypeException forComponent(Class<?> nodeType, String componentName, String message) {
		return new InvalidNodeTypeException("Invalid component " + nodeType.getSimpleName() + "." + componentName + ": " + message);
	}
}
