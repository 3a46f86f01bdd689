package lltable;

/**
 * Base class of all exceptions thrown while building or using an LL(1) table.
 */
public class LLTableException extends RuntimeException {

	public LLTableException(String message) {
		super(message);
	}

	public LLTableException(String message, Throwable cause) {
		super(message, cause);
	}
}
