package lltable.lexer;

import lltable.LocatedLLTableException;
import lltable.util.Utils;

public class LexerError extends LocatedLLTableException {

	public LexerError(Location location, String message) {
		super(location, message);
	}

	public static LexerError unsupported(Location location, char character, String reason){
		return new LexerError(location, String.format("Unsupported character %s: %s",
				Utils.toPrintableRepresentation(Character.toString(character)), reason));
	}
}
