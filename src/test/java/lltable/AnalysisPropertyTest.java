package lltable;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import java.util.*;

import lltable.grammar.*;
import lltable.parser.LLParserTable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of grammars with a single production per non terminal, every such grammar describes exactly one
 * sentence.
 */
@RunWith(JUnitQuickcheck.class)
public class AnalysisPropertyTest {

	private static final String NAMES = "SABCFGHJ";

	private static final String[] TERMINALS = {"a", "b", "c", "x", "y", "+", "*", "(", ")", "id"};

	public static class RawGrammar {
		public final Map<String, String> productions;
		/**
		 * The only sentence of the grammar
		 */
		public final String sentence;

		public RawGrammar(Map<String, String> productions, String sentence) {
			this.productions = productions;
			this.sentence = sentence;
		}

		@Override
		public String toString() {
			return productions + " with sentence \"" + sentence + "\"";
		}
	}

	/**
	 * Non terminals only use non terminals that are declared after them, so there are no cycles.
	 */
	public static class RawGrammars extends Generator<RawGrammar> {

		public RawGrammars() {
			super(RawGrammar.class);
		}

		@Override
		public RawGrammar generate(SourceOfRandomness random, GenerationStatus status) {
			int count = random.nextInt(1, NAMES.length());
			String[] rights = new String[count];
			String[] sentences = new String[count];
			for (int i = count - 1; i >= 0; i--){
				if (i > 0 && random.nextInt(4) == 0){
					rights[i] = Epsilon.RAW_NAME;
					sentences[i] = "";
					continue;
				}
				StringBuilder right = new StringBuilder();
				StringBuilder sentence = new StringBuilder();
				int length = random.nextInt(1, 4);
				for (int j = 0; j < length; j++){
					if (i < count - 1 && random.nextBoolean()){
						int used = random.nextInt(i + 1, count - 1);
						right.append(NAMES.charAt(used));
						sentence.append(sentences[used]);
					} else {
						String terminal = random.choose(TERMINALS);
						right.append(terminal);
						sentence.append(terminal);
					}
				}
				if (i == 0){
					String terminal = random.choose(TERMINALS);
					right.append(terminal);
					sentence.append(terminal);
				}
				rights[i] = right.toString();
				sentences[i] = sentence.toString();
			}
			Map<String, String> productions = new LinkedHashMap<>();
			for (int i = 0; i < count; i++){
				productions.put(Character.toString(NAMES.charAt(i)), rights[i]);
			}
			return new RawGrammar(productions, sentences[0]);
		}
	}

	@Property(trials = 50)
	public void testCorrectionIsIdempotent(@From(RawGrammars.class) RawGrammar raw){
		Grammar corrected = GrammarBuilder.fromRaw(raw.productions).correct();
		assertEquals(corrected, corrected.correct());
		for (NonTerminal nonTerminal : corrected.nonTerminals()){
			assertEquals(1, corrected.getProductions(nonTerminal).size());
		}
	}

	@Property(trials = 50)
	public void testSingleFirstTerminals(@From(RawGrammars.class) RawGrammar raw){
		LLAnalysis analysis = LLAnalysis.build(raw.productions);
		FirstSets first = analysis.getFirstSets();
		LLParserTable table = analysis.getTable();
		for (NonTerminal nonTerminal : analysis.getNonTerminals()){
			Terminal terminal = first.first(nonTerminal);
			for (Terminal lookahead : analysis.getTerminals()){
				assertEquals(lookahead.equals(terminal), table.hasEntry(nonTerminal, lookahead),
						String.format("Entry for %s and %s", nonTerminal, lookahead));
			}
		}
		Terminal startTerminal = first.first(analysis.getGrammar().getStart());
		assertTrue(raw.sentence.startsWith(startTerminal.name), raw.toString());
	}

	@Property(trials = 50)
	public void testFollowSetsEndWithEndOfInput(@From(RawGrammars.class) RawGrammar raw){
		LLAnalysis analysis = LLAnalysis.build(raw.productions);
		for (NonTerminal nonTerminal : analysis.getNonTerminals()){
			List<Terminal> follow = analysis.getFollowSets().get(nonTerminal).asList();
			assertEquals(Terminal.EOF, follow.get(follow.size() - 1));
		}
		assertEquals(Collections.singletonList(Terminal.EOF),
				analysis.getFollowSets().get(analysis.getGrammar().getStart()).asList());
	}

	@Property(trials = 50)
	public void testBuildIsDeterministic(@From(RawGrammars.class) RawGrammar raw){
		LLAnalysis first = LLAnalysis.build(raw.productions);
		LLAnalysis second = LLAnalysis.build(raw.productions);
		assertEquals(first.getTable(), second.getTable());
		assertEquals(first.describe(), second.describe());
	}

	@Property(trials = 50)
	public void testOnlyTheSentenceIsAccepted(@From(RawGrammars.class) RawGrammar raw){
		LLAnalysis analysis = LLAnalysis.build(raw.productions);
		assertAll(
				() -> assertTrue(analysis.parse(raw.sentence).isAccepted(), raw.toString()),
				() -> assertFalse(analysis.parse(raw.sentence + "a").isAccepted(), raw.toString()),
				() -> assertFalse(analysis.parse(raw.sentence.substring(0, raw.sentence.length() - 1)).isAccepted(),
						raw.toString()));
	}
}
