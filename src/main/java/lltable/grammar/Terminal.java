package lltable.grammar;

import java.util.Objects;

/**
 * A terminal symbol, identified by its name.
 */
public class Terminal extends TerminalOrEpsilon {

	/**
	 * End of input marker, it's not equal to a terminal that is named "$"
	 */
	public static final Terminal EOF = new Terminal("$", true);

	/**
	 * The only terminal that consists of more than one character
	 */
	public static final Terminal ID = new Terminal("id");

	public final String name;

	private final boolean eof;

	public Terminal(String name) {
		this(name, false);
	}

	private Terminal(String name, boolean eof) {
		this.name = Objects.requireNonNull(name);
		this.eof = eof;
	}

	public Terminal(char character) {
		this(Character.toString(character));
	}

	public boolean isEOF(){
		return eof;
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public int hashCode() {
		return eof ? -1 : name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Terminal)){
			return false;
		}
		Terminal other = (Terminal) obj;
		return eof == other.eof && name.equals(other.name);
	}

	private Object readResolve() {
		return eof ? EOF : this;
	}
}
