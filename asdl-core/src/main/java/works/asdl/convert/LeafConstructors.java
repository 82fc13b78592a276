package works.asdl.convert;

import static java.util.Objects.requireNonNull;

/**
 * The two productions of a leaf type such as {@code IDENT}.
 *
 * @param tokenConstructor holds the whole string as one token
 * @param subwordConstructor holds the string's subword pieces
 */
public record LeafConstructors(
	String tokenConstructor,
	String subwordConstructor
) {
	public LeafConstructors {
		requireNonNull(tokenConstructor);
		requireNonNull(subwordConstructor);
	}
}
