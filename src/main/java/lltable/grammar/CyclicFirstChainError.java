package lltable.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

import lltable.LLTableException;
import lltable.util.Utils;

/**
 * Thrown if following the leading non terminals of productions leads back to an already visited non terminal,
 * i.e. the grammar is left recursive.
 */
public class CyclicFirstChainError extends LLTableException {

	/**
	 * The non terminals of the cycle, the first one is repeated at the end
	 */
	public final ImmutableList<NonTerminal> cycle;

	public CyclicFirstChainError(List<NonTerminal> cycle) {
		super(String.format("Cyclic chain of leading non terminals: %s", Utils.join(cycle, " → ")));
		this.cycle = ImmutableList.copyOf(cycle);
	}
}
