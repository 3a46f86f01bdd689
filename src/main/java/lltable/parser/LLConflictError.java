package lltable.parser;

import lltable.LLTableException;
import lltable.grammar.NonTerminal;
import lltable.grammar.Production;
import lltable.grammar.Terminal;

/**
 * Thrown if two productions of a non terminal compete for the same lookahead terminal, i.e. the grammar isn't
 * LL(1).
 */
public class LLConflictError extends LLTableException {

	public final NonTerminal nonTerminal;
	public final Terminal lookahead;
	public final Production first;
	public final Production second;

	public LLConflictError(NonTerminal nonTerminal, Terminal lookahead, Production first, Production second) {
		super(String.format("Not LL(1): conflict between %s and %s at lookahead token %s", first, second, lookahead));
		this.nonTerminal = nonTerminal;
		this.lookahead = lookahead;
		this.first = first;
		this.second = second;
	}
}
