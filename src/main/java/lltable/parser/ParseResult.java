package lltable.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lltable.grammar.Production;
import lltable.grammar.Terminal;
import lltable.lexer.Token;
import lltable.util.Utils;

/**
 * Outcome of a parser run: the input is either accepted or rejected.
 *
 * A rejection isn't an error, it carries the token that couldn't be matched and the terminals that would have
 * been accepted instead.
 */
public class ParseResult {

	private final boolean accepted;

	/**
	 * Productions in the order of their expansion, i.e. the (partial) leftmost derivation
	 */
	public final ImmutableList<Production> derivation;

	/**
	 * Unexpected token, null if the input is accepted
	 */
	public final Token errorToken;

	/**
	 * Terminals that would have been accepted instead of the error token, empty if the input is accepted
	 */
	public final ImmutableSet<Terminal> expected;

	private ParseResult(boolean accepted, List<Production> derivation, Token errorToken, ImmutableSet<Terminal> expected) {
		this.accepted = accepted;
		this.derivation = ImmutableList.copyOf(derivation);
		this.errorToken = errorToken;
		this.expected = expected;
	}

	public static ParseResult accept(List<Production> derivation){
		return new ParseResult(true, derivation, null, ImmutableSet.of());
	}

	public static ParseResult reject(List<Production> derivation, Token errorToken, ImmutableSet<Terminal> expected){
		return new ParseResult(false, derivation, errorToken, expected);
	}

	public boolean isAccepted(){
		return accepted;
	}

	public String getMessage(){
		if (accepted){
			return "Successful parse";
		}
		return String.format("String not accepted: unexpected %s, expected {%s}", errorToken,
				Utils.join(expected, " "));
	}

	@Override
	public String toString() {
		return getMessage();
	}
}
