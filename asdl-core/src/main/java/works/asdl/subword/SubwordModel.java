package works.asdl.subword;

import java.util.List;

/**
 * Segments text into subword pieces, in the manner of a SentencePiece model.
 * <p>
 * Pieces that begin a new word start with {@link SubwordPieces#BOUNDARY_MARKER};
 * other pieces continue the word before them.
 * Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface SubwordModel {
	List<String> encodeAsPieces(String text);
}
