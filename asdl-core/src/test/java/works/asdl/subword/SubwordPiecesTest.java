package works.asdl.subword;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubwordPiecesTest {

	@Test
	void emptyPieces_noWords() {
		assertEquals(List.of(), SubwordPieces.toWords(List.of()));
		assertEquals("", SubwordPieces.toText(List.of()));
	}

	@Test
	void unmarkedPiece_oneWord() {
		assertEquals(List.of("foo"), SubwordPieces.toWords(List.of("foo")));
	}

	@Test
	void continuationPieces_joinPreviousWord() {
		assertEquals(List.of("foobar", "baz"), SubwordPieces.toWords(List.of("▁foo", "bar", "▁baz")));
	}

	@Test
	void leadingUnmarkedPiece_startsFirstWord() {
		assertEquals(List.of("xy", "z"), SubwordPieces.toWords(List.of("x", "y", "▁z")));
	}

	@Test
	void bareMarker_emptyWord() {
		assertEquals(List.of("a", "", "b"), SubwordPieces.toWords(List.of("▁a", "▁", "▁b")));
	}

	@Test
	void isWordStart() {
		assertTrue(SubwordPieces.isWordStart("▁x"));
		assertFalse(SubwordPieces.isWordStart("x▁"));
		assertFalse(SubwordPieces.isWordStart(""));
	}

	@ParameterizedTest
	@MethodSource("texts")
	void reassembly_restoresSingleSpacedText(String text) {
		for (int chunkSize = 1; chunkSize <= 4; chunkSize++) {
			List<String> pieces = new ChunkingSubwordModel(chunkSize).encodeAsPieces(text);
			assertEquals(text, SubwordPieces.toText(pieces), "chunk size " + chunkSize);
		}
	}

	static Stream<String> texts() {
		return Stream.of(
			"x",
			"main",
			"counter_value",
			"hello world",
			"%d items left\\n",
			"a b c d"
		);
	}
}
