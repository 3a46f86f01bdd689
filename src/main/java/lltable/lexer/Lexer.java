package lltable.lexer;

/**
 * A simple interface for a pull lexer.
 */
public interface Lexer {

	/**
	 * Get the current token (calls next() if no token has been read before).
	 */
	Token cur();

	/**
	 * Read another token and return it. Returns the end of input token again and again once it's reached.
	 */
	Token next();

	/**
	 * Ignores tokens that consist of the passed character in subsequent readings.
	 */
	void ignore(char character);
}
