package lltable.grammar;

import lltable.LLTableException;

/**
 * Thrown if a grammar is structurally broken: an empty right hand side, a reference to an undefined non terminal
 * or a symbol that isn't part of the grammar notation.
 */
public class MalformedGrammarError extends LLTableException {

	public MalformedGrammarError(String message) {
		super(message);
	}

	public MalformedGrammarError(String message, Throwable cause) {
		super(message, cause);
	}
}
