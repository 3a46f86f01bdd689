package lltable.grammar;

import java.util.Objects;

/**
 * A non terminal symbol. Its productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	/**
	 * Name of the non terminal, typically uppercase
	 */
	public final String name;

	public NonTerminal(String name) {
		this.name = Objects.requireNonNull(name);
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NonTerminal && ((NonTerminal) obj).name.equals(name);
	}
}
