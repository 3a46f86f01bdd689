package lltable.lexer;

import lltable.grammar.Symbol;
import lltable.grammar.Terminal;
import lltable.util.Utils;

public class Token {

	/**
	 * Symbol this token stands for, a terminal (or a non terminal when lexing right hand sides of productions)
	 */
	public final Symbol symbol;

	/**
	 * Matched text.
	 */
	public final String value;

	public final Location location;

	public Token(Symbol symbol, String value, Location location){
		this.symbol = symbol;
		this.value = value;
		this.location = location;
	}

	public boolean isEOF(){
		return symbol instanceof Terminal && ((Terminal) symbol).isEOF();
	}

	public boolean isTerminal(Terminal terminal){
		return symbol.equals(terminal);
	}

	@Override
	public String toString() {
		return (isEOF() ? "EOF" : Utils.toPrintableRepresentation(value)) + location;
	}

	public String toSimpleString(){
		return symbol.toString();
	}
}
