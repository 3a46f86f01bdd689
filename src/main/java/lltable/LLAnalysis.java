package lltable;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSet;

import lltable.grammar.*;
import lltable.lexer.SymbolLexer;
import lltable.parser.LLParser;
import lltable.parser.LLParserTable;
import lltable.parser.ParseResult;

/**
 * Everything needed to parse with a grammar: the corrected grammar, its first and follow sets and the LL(1)
 * parser table. Instances are immutable and can be used for any number of parser runs.
 *
 * <pre>
 *     Map&lt;String, String&gt; raw = new LinkedHashMap&lt;&gt;();
 *     raw.put("S", "aBb");
 *     raw.put("B", "+C");
 *     raw.put("C", "(D)");
 *     raw.put("D", "id");
 *     LLAnalysis.build(raw).parse("a+(id)b").isAccepted(); // true
 * </pre>
 */
public class LLAnalysis {

	private static final Logger LOG = Logger.getLogger(LLAnalysis.class.getName());

	private static final char[] WHITESPACE = {' ', '\t', '\r', '\n'};

	private final Grammar grammar;
	private final FirstSets firstSets;
	private final FollowSets followSets;
	private final LLParserTable table;

	private LLAnalysis(Grammar grammar, FirstSets firstSets, FollowSets followSets, LLParserTable table) {
		this.grammar = grammar;
		this.firstSets = firstSets;
		this.followSets = followSets;
		this.table = table;
	}

	/**
	 * Analyses the passed raw grammar.
	 *
	 * @param rawGrammar maps non terminal names to right hand sides in the single character notation, the first
	 *                   entry defines the start non terminal
	 * @see GrammarBuilder#fromRawGrammar(Map)
	 */
	public static LLAnalysis build(Map<String, String> rawGrammar){
		return build(GrammarBuilder.fromRaw(rawGrammar));
	}

	public static LLAnalysis build(Grammar grammar){
		return build(grammar, Config.failOnConflict());
	}

	/**
	 * Corrects the grammar and calculates the first sets, the follow sets and the parser table.
	 *
	 * @throws MalformedGrammarError if the grammar is broken
	 * @throws CyclicFirstChainError if the grammar is left recursive
	 * @throws lltable.parser.LLConflictError if the grammar isn't LL(1) and failOnConflict is set
	 */
	public static LLAnalysis build(Grammar grammar, boolean failOnConflict){
		Grammar corrected = grammar.correct();
		FirstSets first = FirstSets.of(corrected);
		FollowSets follow = FollowSets.of(corrected, first);
		LLParserTable table = LLParserTable.fromGrammar(corrected, first, follow, failOnConflict);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built the parser table for %d non terminals and %d terminals",
					corrected.nonTerminals().size(), corrected.terminals().size()));
		}
		return new LLAnalysis(corrected, first, follow, table);
	}

	/**
	 * Parses the passed input. Whitespace is skipped if the configuration says so.
	 *
	 * @see Config#skipWhitespace()
	 */
	public ParseResult parse(String input){
		SymbolLexer lexer = new SymbolLexer(input);
		if (Config.skipWhitespace()){
			for (char c : WHITESPACE){
				lexer.ignore(c);
			}
		}
		return new LLParser(table, lexer).parse();
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public FirstSets getFirstSets(){
		return firstSets;
	}

	public FollowSets getFollowSets(){
		return followSets;
	}

	public LLParserTable getTable(){
		return table;
	}

	public ImmutableSet<NonTerminal> getNonTerminals(){
		return grammar.nonTerminals();
	}

	public ImmutableSet<Terminal> getTerminals(){
		return grammar.terminals();
	}

	/**
	 * Plain text description of the grammar, the first and follow sets and the table.
	 */
	public String describe(){
		return "grammar:\n" + grammar + "\n" +
				"firsts:\n" + firstSets + "\n" +
				"follows:\n" + followSets + "\n" +
				"table:\n" + table;
	}

	@Override
	public String toString() {
		return describe();
	}
}
