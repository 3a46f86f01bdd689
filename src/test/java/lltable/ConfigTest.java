package lltable;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.logging.Level;

import lltable.grammar.GrammarBuilder;
import lltable.grammar.NonTerminal;
import lltable.parser.LLConflictError;

import static lltable.AnalysisMatcher.raw;
import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void resetConfig(){
		Config.reset();
	}

	private static void load(String lines) throws IOException {
		Config.load(new BufferedReader(new StringReader(lines)));
	}

	@Test
	public void testDefaults(){
		assertTrue(Config.failOnConflict());
		assertTrue(Config.skipWhitespace());
		assertEquals(Level.INFO, Config.logLevel());
	}

	@Test
	public void testLoad() throws IOException {
		load("failOnConflict = no\nskipWhitespace = no\nlogLevel = FINE\nunknownKey = 1\nno assignment here");
		assertFalse(Config.failOnConflict());
		assertFalse(Config.skipWhitespace());
		assertEquals(Level.FINE, Config.logLevel());
	}

	@Test
	public void testUnknownLogLevel() throws IOException {
		load("logLevel = LOUD");
		assertEquals(Level.INFO, Config.logLevel());
	}

	@Test
	public void testWhitespaceIsPartOfTheInput() throws IOException {
		LLAnalysis analysis = LLAnalysis.build(raw("S", "ab"));
		assertTrue(analysis.parse("a b").isAccepted());
		load("skipWhitespace = no");
		assertFalse(analysis.parse("a b").isAccepted());
		assertTrue(analysis.parse("ab").isAccepted());
	}

	@Test
	public void testConflictHandling() throws IOException {
		assertThrows(LLConflictError.class, () -> LLAnalysis.build(raw("S", "a|ab")));
		load("failOnConflict = no");
		LLAnalysis analysis = LLAnalysis.build(GrammarBuilder.fromRaw(raw("S", "a|ab")));
		assertEquals("S → a b", analysis.getTable().row(new NonTerminal("S")).values().iterator().next().toString());
	}
}
