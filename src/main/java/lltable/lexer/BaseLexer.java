package lltable.lexer;

import java.util.HashSet;
import java.util.Set;

import lltable.grammar.Terminal;

public abstract class BaseLexer implements Lexer {

	private Token curToken = null;
	private final Set<Terminal> ignoredTerminals = new HashSet<>();

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	protected abstract Token parseNextToken();

	@Override
	public Token next() {
		if (curToken != null && curToken.isEOF()){
			return curToken;
		}
		do {
			curToken = parseNextToken();
		} while (ignoredTerminals.contains(curToken.symbol));
		return curToken;
	}

	@Override
	public void ignore(char character) {
		ignoredTerminals.add(new Terminal(character));
	}
}
