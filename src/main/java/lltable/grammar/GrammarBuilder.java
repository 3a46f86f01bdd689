package lltable.grammar;

import java.util.*;

import lltable.lexer.LexerError;
import lltable.lexer.SymbolLexer;
import lltable.lexer.Token;

/**
 * Allows the simple creation of grammars.
 *
 * Productions can be added in two forms:
 * <ul>
 *     <li>{@link #add(String, Object...)}: strings are names of non terminals, characters and {@link Terminal}s are
 *     terminals and "" is ε</li>
 *     <li>{@link #addRaw(String, String)}: the single character notation, e.g. <pre>"aBb"</pre>, alternatives are
 *     separated by "|", "ep" is ε and "id" is a single terminal</li>
 * </ul>
 * Symbols are resolved in {@link #toGrammar(String)}, therefore non terminals can be used before their
 * productions are added.
 */
public class GrammarBuilder {

	private static final String ALTERNATIVE_SEPARATOR = "|";

	private static final char[] IGNORED_CHARACTERS = {' ', '\t', '\r', '\n'};

	/**
	 * Names of the non terminals on the left hand sides in the order of their first production
	 */
	private final Set<String> definedNonTerminals = new LinkedHashSet<>();

	private final List<PendingProduction> productions = new ArrayList<>();

	private static class PendingProduction {
		final String left;
		final Object[] right;
		final String raw;

		PendingProduction(String left, Object[] right, String raw) {
			this.left = left;
			this.right = right;
			this.raw = raw;
		}
	}

	/**
	 * Creates a builder that contains the productions of the passed raw grammar.
	 *
	 * @param rawGrammar maps the names of the non terminals to their right hand sides in the single character
	 *                   notation, its iteration order is the declaration order (use a LinkedHashMap)
	 */
	public static GrammarBuilder fromRawGrammar(Map<String, String> rawGrammar){
		GrammarBuilder builder = new GrammarBuilder();
		for (Map.Entry<String, String> entry : rawGrammar.entrySet()){
			builder.addRaw(entry.getKey(), entry.getValue());
		}
		return builder;
	}

	/**
	 * Builds the grammar of the passed raw grammar, its first non terminal is the start non terminal.
	 *
	 * @see #fromRawGrammar(Map)
	 */
	public static Grammar fromRaw(Map<String, String> rawGrammar){
		return fromRawGrammar(rawGrammar).toGrammar();
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are
	 *  - strings: names of non terminals
	 *  - characters or terminals: terminals
	 *  - "": equivalent to ε
	 *  - arrays of the above
	 * An empty right hand side is equivalent to ε.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, Object... right){
		checkNonTerminalName(left);
		definedNonTerminals.add(left);
		productions.add(new PendingProduction(left, flatten(right), null));
		return this;
	}

	/**
	 * Adds the productions of the passed right hand side in the single character notation.
	 *
	 * @param left name of the defining non terminal
	 * @param right alternatives separated by "|", each one is either "ep" or a non empty sequence of symbols
	 */
	public GrammarBuilder addRaw(String left, String right){
		checkNonTerminalName(left);
		definedNonTerminals.add(left);
		for (String alternative : right.split("\\" + ALTERNATIVE_SEPARATOR, -1)){
			productions.add(new PendingProduction(left, null, alternative));
		}
		return this;
	}

	private void checkNonTerminalName(String name){
		if (name == null || name.trim().isEmpty()){
			throw new MalformedGrammarError("Empty non terminal name");
		}
		if (name.contains(ALTERNATIVE_SEPARATOR) || name.contains("$")){
			throw new MalformedGrammarError(String.format("Non terminal name \"%s\" contains a reserved character",
					name));
		}
	}

	private static Object[] flatten(Object[] arr){
		List<Object> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof Object[]){
				ret.addAll(Arrays.asList(flatten((Object[]) sub)));
			} else {
				ret.add(sub);
			}
		}
		return ret.toArray();
	}

	/**
	 * Builds the grammar, the first defined non terminal is the start non terminal.
	 */
	public Grammar toGrammar(){
		if (definedNonTerminals.isEmpty()){
			throw new MalformedGrammarError("A grammar needs at least one production");
		}
		return toGrammar(definedNonTerminals.iterator().next());
	}

	/**
	 * Builds the grammar.
	 *
	 * @param startNonTerminal name of the start non terminal
	 * @throws MalformedGrammarError if a right hand side is empty, uses undefined non terminals or unsupported
	 *                               symbols
	 */
	public Grammar toGrammar(String startNonTerminal) {
		if (!definedNonTerminals.contains(startNonTerminal)){
			throw new MalformedGrammarError(String.format("Unknown start non terminal %s", startNonTerminal));
		}
		List<Production> result = new ArrayList<>();
		for (PendingProduction pending : productions){
			List<Symbol> right = pending.raw != null ? parseRaw(pending.left, pending.raw) : convert(pending);
			result.add(new Production(result.size(), new NonTerminal(pending.left), right));
		}
		return new Grammar(new NonTerminal(startNonTerminal), result);
	}

	private List<Symbol> parseRaw(String left, String raw){
		if (raw.trim().equals(Epsilon.RAW_NAME)){
			return Collections.singletonList(new Epsilon());
		}
		SymbolLexer lexer = new SymbolLexer(raw, definedNonTerminals, true);
		for (char character : IGNORED_CHARACTERS){
			lexer.ignore(character);
		}
		List<Symbol> right = new ArrayList<>();
		try {
			for (Token token : lexer.tokens()){
				if (!token.isEOF()){
					right.add(token.symbol);
				}
			}
		} catch (LexerError error){
			throw new MalformedGrammarError(String.format("Can't read the right hand side \"%s\" of %s: %s", raw,
					left, error.getMessage()), error);
		}
		if (right.isEmpty()){
			throw new MalformedGrammarError(String.format("Empty right hand side for %s, use \"%s\" for ε", left,
					Epsilon.RAW_NAME));
		}
		return right;
	}

	private List<Symbol> convert(PendingProduction pending){
		List<Symbol> right = new ArrayList<>();
		for (Object obj : pending.right){
			if (obj instanceof String){
				String str = (String) obj;
				if (str.isEmpty()){
					right.add(new Epsilon());
				} else if (definedNonTerminals.contains(str)){
					right.add(new NonTerminal(str));
				} else {
					throw new MalformedGrammarError(String.format("Undefined non terminal %s used in a production " +
							"of %s", str, pending.left));
				}
			} else if (obj instanceof Character){
				right.add(convertTerminal(new Terminal((Character) obj), pending.left));
			} else if (obj instanceof Terminal){
				right.add(convertTerminal((Terminal) obj, pending.left));
			} else if (obj instanceof Epsilon){
				right.add((Epsilon) obj);
			} else {
				throw new MalformedGrammarError(String.format("Right part of a production of %s has unsupported " +
						"type: %s", pending.left, obj));
			}
		}
		return right;
	}

	private Terminal convertTerminal(Terminal terminal, String left){
		if (terminal.isEOF() || terminal.name.equals("$")){
			throw new MalformedGrammarError(String.format("The end of input marker can't be used in a production " +
					"of %s", left));
		}
		return terminal;
	}
}
