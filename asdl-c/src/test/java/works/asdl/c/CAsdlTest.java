package works.asdl.c;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.asdl.c.ast.CAst.Assignment;
import works.asdl.c.ast.CAst.BinaryOp;
import works.asdl.c.ast.CAst.Constant;
import works.asdl.c.ast.CAst.FileAST;
import works.asdl.c.ast.CAst.ID;
import works.asdl.c.ast.CAst.Node;
import works.asdl.c.ast.CAst.Return;
import works.asdl.convert.AstConverter;
import works.asdl.convert.NodeShape;
import works.asdl.grammar.Grammar;
import works.asdl.grammar.Production;
import works.asdl.subword.ChunkingSubwordModel;
import works.asdl.tree.AsdlTree;
import works.asdl.tree.Token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.asdl.c.CSamples.id;
import static works.asdl.c.CSamples.intConst;

class CAsdlTest {
	final Grammar grammar = CAsdl.grammar();

	static Stream<FileAST> samples() {
		return CSamples.all().stream();
	}

	@Test
	void grammarIsLoadedOnce() {
		assertSame(CAsdl.grammar(), CAsdl.grammar());
		assertEquals("EXPR", grammar.rootType());
	}

	@Test
	void everyNodeTypeHasAProduction() {
		for (NodeShape shape: CAsdl.registry().shapes()) {
			Production p = grammar.production(shape.name());
			assertEquals("EXPR", p.type(), shape.name());
			assertEquals(p.fields().size(), shape.components().size(), shape.name());
		}
		assertEquals(grammar.productionsOf("EXPR").size(), CAsdl.registry().shapes().size());
	}

	@ParameterizedTest
	@MethodSource("samples")
	void roundTrip(FileAST program) {
		AsdlTree tree = CAsdl.toAsdl(program, grammar);
		assertEquals(program, CAsdl.toC(tree, grammar));
	}

	@ParameterizedTest
	@MethodSource("samples")
	void roundTrip_withSubwords(FileAST program) {
		for (int chunkSize = 1; chunkSize <= 3; chunkSize++) {
			AstConverter<Node> converter = CAsdl.converter(grammar, new ChunkingSubwordModel(chunkSize));
			assertEquals(program, converter.decode(converter.encode(program)), "chunk size " + chunkSize);
		}
	}

	@Test
	void encodeBinaryOp() {
		AsdlTree tree = CAsdl.toAsdl(new BinaryOp("<<", id("x"), intConst("3")), grammar);
		assertEquals(
			"(BinaryOp (op (LShift)) (left (ID (name (IdentToken (token \"x\"))))) (right (Constant (type (IntLiteral)) (value (StrToken (token \"3\"))))))",
			tree.toString());
	}

	@Test
	void encodeWithSubwords() {
		AsdlTree tree = CAsdl.converter(grammar, new ChunkingSubwordModel(4)).encode(new ID("counter"));
		AsdlTree leaf = (AsdlTree) tree.field("name").values().get(0);
		assertEquals("IdentSubword", leaf.constructorName());
		assertEquals(
			List.of(Token.of("▁cou"), Token.of("nter")),
			leaf.field("pieces").values());
	}

	@Test
	void literalKindNormalization() {
		AsdlTree tree = CAsdl.toAsdl(new Constant("long int", "5L"), grammar);
		AsdlTree kind = (AsdlTree) tree.field("type").values().get(0);
		assertEquals("IntLiteral", kind.constructorName());
		assertEquals(new Constant("int", "5L"), CAsdl.toC(tree, grammar));
	}

	@Test
	void convenienceMethodsShareConverter() {
		Node node = new Return(new Assignment("|=", id("flags"), intConst("4")));
		assertEquals(CAsdl.toAsdl(node, grammar), CAsdl.converter(grammar, null).encode(node));
	}

	@Test
	void convertersAreIndependent() {
		assertNotSame(CAsdl.converter(grammar, null), CAsdl.converter(grammar, null));
	}

	@Test
	void bundledGrammarReadsFresh() {
		Grammar fresh = CAsdl.readBundledGrammar();
		assertNotSame(grammar, fresh);
		assertEquals(grammar.productions(), fresh.productions());
		assertTrue(fresh.isPrimitive("TOKEN"));
	}
}
