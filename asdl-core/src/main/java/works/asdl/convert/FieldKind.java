package works.asdl.convert;

/**
 * How the converter treats the values of a field, determined by the field's type.
 */
enum FieldKind {
	/**
	 * A grammar type whose productions correspond to native node types.
	 */
	COMPOSITE,

	/**
	 * A string encoded as a token leaf or a subword leaf.
	 * @see ConverterSettings#getLeafTypes()
	 */
	LEAF,

	/**
	 * A lexical token mapped through a {@link TerminalTable}.
	 */
	TERMINAL,

	/**
	 * A primitive type; the string is stored as a raw token.
	 */
	PRIMITIVE,
}
