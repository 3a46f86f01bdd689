package lltable.grammar;

/**
 * Common super type of everything that can be part of a first set.
 */
public abstract class TerminalOrEpsilon extends Symbol {
}
