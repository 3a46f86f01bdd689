package lltable;

import lltable.lexer.Location;

public class LocatedLLTableException extends LLTableException {

	public final Location errorLocation;

	public LocatedLLTableException(Location errorLocation, String message) {
		super(String.format("Error at %s: %s", errorLocation, message));
		this.errorLocation = errorLocation;
	}
}
