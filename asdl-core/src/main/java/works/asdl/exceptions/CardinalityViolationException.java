package works.asdl.exceptions;

import works.asdl.grammar.Cardinality;
import works.asdl.grammar.Field;
import works.asdl.grammar.Production;

/**
 * The number of values in a field disagrees with the field's {@link Cardinality}.
 * <p>
 * This is a contract violation rather than ordinary bad input:
 * it means a malformed tree was handed to the decoder,
 * a native node was built without a required field,
 * or the grammar and the native node types have drifted apart.
 */
public final class CardinalityViolationException extends AsdlException {
	private final String constructorName;
	private final String fieldName;
	private final int actualCount;

	public CardinalityViolationException(String constructorName, String fieldName, int actualCount, String message) {
		super(message);
		this.constructorName = constructorName;
		this.fieldName = fieldName;
		this.actualCount = actualCount;
	}

	CardinalityViolationException(String constructorName, String fieldName, int actualCount, String message, Throwable cause) {
		super(message, cause);
		this.constructorName = constructorName;
		this.fieldName = fieldName;
		this.actualCount = actualCount;
	}

	public static CardinalityViolationException missingRequiredField(Production production, Field field) {
		return new CardinalityViolationException(production.constructorName(), field.name(), 0,
			"Missing required field " + production.constructorName() + "." + field.name());
	}

	public static CardinalityViolationException wrongCount(Production production, Field field, int actualCount) {
		return new CardinalityViolationException(production.constructorName(), field.name(), actualCount,
			"Field " + production.constructorName() + "." + field.name()
				+ " is " + field.cardinality().description()
				+ " but has " + actualCount + " values");
	}

	public String constructorName() {
		return constructorName;
	}

	public String fieldName() {
		return fieldName;
	}

	public int actualCount() {
		return actualCount;
	}
}
