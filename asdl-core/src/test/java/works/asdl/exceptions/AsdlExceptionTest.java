package works.asdl.exceptions;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.asdl.grammar.Field;
import works.asdl.grammar.Production;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class AsdlExceptionTest {

	@Test
	void wrapKeepsTypeAndDetails() {
		var original = UnknownTerminalException.unknownToken("QUAL", "mutable");
		UnknownTerminalException wrapped = AsdlException.wrap(original, "Decl.quals");
		assertEquals("QUAL", wrapped.fieldType());
		assertEquals("mutable", wrapped.value());
		assertEquals("Decl.quals: " + original.getMessage(), wrapped.getMessage());
		assertSame(original, wrapped.getCause());
	}

	@Test
	void wrapNests() {
		Field field = Field.single("EXPR", "type");
		Production production = new Production("EXPR", "Decl", List.of(field));
		var original = CardinalityViolationException.missingRequiredField(production, field);
		var wrapped = AsdlException.wrap(AsdlException.wrap(original, "Decl.type"), "FileAST.ext");
		assertEquals("FileAST.ext: Decl.type: Missing required field Decl.type", wrapped.getMessage());
		assertEquals("Decl", wrapped.constructorName());
		assertEquals(0, wrapped.actualCount());
	}

	@Test
	void wrapSyntax() {
		var wrapped = AsdlException.wrap(new AsdlSyntaxException(7, "oops"), "c.asdl");
		assertEquals(7, wrapped.lineNumber());
		assertEquals("c.asdl: Line 7: oops", wrapped.getMessage());
	}

	@Test
	void wrongCountMessage() {
		Field field = Field.optional("EXPR", "init");
		Production production = new Production("EXPR", "Decl", List.of(field));
		var e = CardinalityViolationException.wrongCount(production, field, 2);
		assertEquals("Field Decl.init is optional but has 2 values", e.getMessage());
	}
}
