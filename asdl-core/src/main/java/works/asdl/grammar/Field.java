package works.asdl.grammar;

import static java.util.Objects.requireNonNull;

/**
 * A field specification: one named, typed slot of a {@link Production}.
 *
 * @param type the name of the field's type, which is either a type defined by the grammar
 *             or one of its primitive types
 */
public record Field(
	String name,
	String type,
	Cardinality cardinality
) {
	public Field {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(cardinality);
	}

	public static Field single(String type, String name) {
		return new Field(name, type, Cardinality.SINGLE);
	}

	public static Field optional(String type, String name) {
		return new Field(name, type, Cardinality.OPTIONAL);
	}

	public static Field multiple(String type, String name) {
		return new Field(name, type, Cardinality.MULTIPLE);
	}

	/**
	 * @return the field in ASDL notation, like {@code EXPR* block_items}
	 */
	@Override
	public String toString() {
		return type + cardinality.suffix() + " " + name;
	}
}
