package lltable.lexer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import lltable.grammar.NonTerminal;
import lltable.grammar.Terminal;

/**
 * Lexer for the single character notation of grammars and parser inputs.
 *
 * Every character is a terminal of its own, with two exceptions: the characters "id" form the single terminal
 * {@link Terminal#ID} and the names of the passed non terminals are lexed as non terminals (the longest name wins).
 *
 * In strict mode (used for right hand sides of productions) a lone "d" and the end of input marker "$" are
 * rejected, as they can't be part of a grammar.
 */
public class SymbolLexer extends BaseLexer {

	private final String input;
	private final List<String> nonTerminalNames;
	private final boolean strict;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	/**
	 * Creates a non strict lexer for parser inputs.
	 */
	public SymbolLexer(String input){
		this(input, Collections.emptyList(), false);
	}

	public SymbolLexer(String input, Collection<String> nonTerminalNames, boolean strict){
		this.input = input;
		this.nonTerminalNames = new ArrayList<>(nonTerminalNames);
		this.nonTerminalNames.sort(Comparator.comparingInt(String::length).reversed());
		this.strict = strict;
	}

	/**
	 * Reads all tokens, the last one is the end of input token.
	 */
	public List<Token> tokens(){
		List<Token> tokens = new ArrayList<>();
		tokens.add(cur());
		while (!cur().isEOF()){
			tokens.add(next());
		}
		return tokens;
	}

	@Override
	protected Token parseNextToken() {
		Location location = new Location(line, column);
		if (pos >= input.length()){
			return new Token(Terminal.EOF, "", location);
		}
		for (String name : nonTerminalNames){
			if (input.startsWith(name, pos)){
				advance(name);
				return new Token(new NonTerminal(name), name, location);
			}
		}
		if (input.startsWith(Terminal.ID.name, pos)){
			advance(Terminal.ID.name);
			return new Token(Terminal.ID, Terminal.ID.name, location);
		}
		char cur = input.charAt(pos);
		if (strict && cur == 'd'){
			throw LexerError.unsupported(location, cur, "\"d\" is only allowed as part of \"id\"");
		}
		if (strict && cur == '$'){
			throw LexerError.unsupported(location, cur, "\"$\" is reserved for the end of input");
		}
		String value = Character.toString(cur);
		advance(value);
		return new Token(new Terminal(cur), value, location);
	}

	private void advance(String matched){
		for (char c : matched.toCharArray()){
			if (c == '\n'){
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		pos += matched.length();
	}
}
