package works.asdl.subword;

import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles subword pieces into words.
 * <p>
 * Reassembly is total: any sequence of pieces yields some sequence of words.
 */
public final class SubwordPieces {
	/**
	 * Marks a piece that begins a new word. Assumed never to occur in ordinary text.
	 */
	public static final char BOUNDARY_MARKER = '▁';

	private SubwordPieces() {}

	/**
	 * A piece starting with {@link #BOUNDARY_MARKER} ends the word in progress and starts a new one
	 * with the marker removed; any other piece is appended to the word in progress.
	 * A leading piece without the marker simply starts the first word.
	 */
	public static List<String> toWords(List<String> pieces) {
		List<String> words = new ArrayList<>();
		StringBuilder current = null;
		for (String piece: pieces) {
			if (isWordStart(piece)) {
				if (current != null) {
					words.add(current.toString());
				}
				current = new StringBuilder(piece.substring(1));
			} else if (current == null) {
				current = new StringBuilder(piece);
			} else {
				current.append(piece);
			}
		}
		if (current != null) {
			words.add(current.toString());
		}
		return words;
	}

	/**
	 * @return the words of {@code pieces} joined with single spaces
	 */
	public static String toText(List<String> pieces) {
		return String.join(" ", toWords(pieces));
	}

	public static boolean isWordStart(String piece) {
		return !piece.isEmpty() && piece.charAt(0) == BOUNDARY_MARKER;
	}
}
