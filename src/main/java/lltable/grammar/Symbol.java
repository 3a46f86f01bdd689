package lltable.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols, non terminal symbols and epsilon.
 */
public abstract class Symbol implements Serializable {
}
