package lltable.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lltable.grammar.NonTerminal;
import lltable.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolLexerTest {

	private static String lex(SymbolLexer lexer){
		return lexer.tokens().stream().map(Token::toSimpleString).collect(Collectors.joining(" "));
	}

	@ParameterizedTest
	@CsvSource({
			"'a+(id)b', 'a + ( id ) b $'",
			"'add', 'a d d $'",
			"'iid', 'i id $'",
			"'', '$'",
			"'a$', 'a $ $'"
	})
	public void testTokens(String input, String expected){
		assertEquals(expected, lex(new SymbolLexer(input)));
	}

	@Test
	public void testDollarIsNoEndOfInput(){
		List<Token> tokens = new SymbolLexer("$").tokens();
		assertEquals(2, tokens.size());
		assertFalse(tokens.get(0).isEOF());
		assertEquals(new Terminal('$'), tokens.get(0).symbol);
		assertTrue(tokens.get(1).isEOF());
	}

	@ParameterizedTest
	@ValueSource(strings = {"d", "ad", "a$", "i d"})
	public void testStrictMode(String input){
		assertThrows(LexerError.class, () -> new SymbolLexer(input, Collections.emptyList(), true).tokens());
	}

	@Test
	public void testStrictErrorLocation(){
		LexerError error = assertThrows(LexerError.class,
				() -> new SymbolLexer("ab$", Collections.emptyList(), true).tokens());
		assertEquals(3, error.errorLocation.column);
		assertTrue(error.getMessage().startsWith("Error at [1:3]"));
	}

	@Test
	public void testLongestNonTerminalName(){
		List<Token> tokens = new SymbolLexer("TE'E", Arrays.asList("E", "E'"), true).tokens();
		assertAll(
				() -> assertEquals(new Terminal('T'), tokens.get(0).symbol),
				() -> assertEquals(new NonTerminal("E'"), tokens.get(1).symbol),
				() -> assertEquals(new NonTerminal("E"), tokens.get(2).symbol),
				() -> assertTrue(tokens.get(3).isEOF()));
	}

	@Test
	public void testLocations(){
		List<Token> tokens = new SymbolLexer("a\nid").tokens();
		assertEquals("[\"a\"[1:1], \"\\n\"[1:2], \"id\"[2:1], EOF[2:3]]", tokens.toString());
	}

	@Test
	public void testIgnore(){
		SymbolLexer lexer = new SymbolLexer(" a \n b ");
		lexer.ignore(' ');
		lexer.ignore('\n');
		List<Token> tokens = lexer.tokens();
		assertEquals("a b $", tokens.stream().map(Token::toSimpleString).collect(Collectors.joining(" ")));
		assertEquals(2, tokens.get(1).location.line);
		assertEquals(2, tokens.get(1).location.column);
	}

	@Test
	public void testEndOfInputRepeats(){
		SymbolLexer lexer = new SymbolLexer("a");
		assertEquals("a", lexer.cur().value);
		assertTrue(lexer.next().isEOF());
		Token eof = lexer.cur();
		assertSame(eof, lexer.next());
		assertSame(eof, lexer.next());
	}
}
