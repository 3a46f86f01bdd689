package lltable.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import lltable.lexer.SymbolLexer;
import lltable.util.Utils;

import static lltable.parser.LLParserTableTest.EXPRESSIONS;
import static lltable.parser.LLParserTableTest.SIMPLE;
import static lltable.parser.LLParserTableTest.table;
import static org.junit.jupiter.api.Assertions.*;

public class LLParserTest {

	private static ParseResult parse(LLParserTable table, String input){
		SymbolLexer lexer = new SymbolLexer(input);
		lexer.ignore(' ');
		return new LLParser(table, lexer).parse();
	}

	@Test
	public void testAccept(){
		ParseResult result = parse(table(SIMPLE, true), "a + ( id ) b");
		assertTrue(result.isAccepted());
		assertNull(result.errorToken);
		assertTrue(result.expected.isEmpty());
		assertEquals(4, result.derivation.size());
	}

	@Test
	public void testDerivationWithEpsilonProductions(){
		ParseResult result = parse(table(EXPRESSIONS, true), "id");
		assertEquals("E → T X, T → F Y, F → id, Y → ε, X → ε", Utils.join(result.derivation, ", "));
	}

	@ParameterizedTest
	@CsvSource({
			"'a+(x)b', 'x', '1:4', 'id'",
			"'a+(id)', '$', '1:7', 'b'",
			"'a+(id)bb', 'b', '1:8', '$'",
			"'a$', '$', '1:2', '+'",
			"'+', '+', '1:1', 'a'",
			"'', '$', '1:1', 'a'"
	})
	public void testReject(String input, String unexpected, String location, String expected){
		ParseResult result = parse(table(SIMPLE, true), input);
		assertAll(
				() -> assertFalse(result.isAccepted()),
				() -> assertEquals(unexpected, result.errorToken.toSimpleString()),
				() -> assertEquals("[" + location + "]", result.errorToken.location.toString()),
				() -> assertEquals(expected, Utils.join(result.expected, " ")));
	}

	@Test
	public void testTrailingDollar(){
		ParseResult result = parse(table(SIMPLE, true), "a+(id)b$");
		assertFalse(result.isAccepted());
		assertFalse(result.errorToken.isEOF());
		assertEquals("$", Utils.join(result.expected, " "));
	}

	@Test
	public void testRejectMessage(){
		assertEquals("String not accepted: unexpected \"x\"[1:4], expected {id}",
				parse(table(SIMPLE, true), "a+(x)b").getMessage());
		assertEquals("String not accepted: unexpected \"(\"[1:3], expected {+ * ) $}",
				parse(table(EXPRESSIONS, true), "id(").getMessage());
		assertEquals("String not accepted: unexpected EOF[1:4], expected {( id}",
				parse(table(EXPRESSIONS, true), "id+").getMessage());
	}

	@Test
	public void testPartialDerivation(){
		ParseResult result = parse(table(EXPRESSIONS, true), "id+");
		assertFalse(result.isAccepted());
		assertTrue(result.errorToken.isEOF());
		assertEquals("( id", Utils.join(result.expected, " "));
		assertEquals("X → + T X", result.derivation.get(result.derivation.size() - 1).toString());
	}

	@Test
	public void testSingleUse(){
		LLParser parser = new LLParser(table(SIMPLE, true), new SymbolLexer("a+(id)b"));
		assertTrue(parser.parse().isAccepted());
		assertThrows(IllegalStateException.class, parser::parse);
	}
}
