package lltable.grammar;

/**
 * The empty word. All instances are equal.
 */
public class Epsilon extends TerminalOrEpsilon {

	/**
	 * Name of epsilon in the raw grammar notation
	 */
	public static final String RAW_NAME = "ep";

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Epsilon;
	}

	@Override
	public String toString() {
		return "ε";
	}
}
