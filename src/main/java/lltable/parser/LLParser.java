package lltable.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSet;

import lltable.grammar.*;
import lltable.lexer.Lexer;
import lltable.lexer.Token;

/**
 * Implements a table driven LL(1) recognizer. It only accepts or rejects the input, no syntax tree is built.
 *
 * The stack starts with the start non terminal on top of the end of input marker. The parser expands the
 * non terminal on top of the stack with the production from the table, matches terminals on top of the stack
 * with the current token and accepts when the end of input marker meets the end of the input.
 *
 * An instance can only be used for a single run.
 */
public class LLParser {

	private static final Logger LOG = Logger.getLogger(LLParser.class.getName());

	private final LLParserTable table;
	private final List<Token> tokens = new ArrayList<>();
	private int currentTokenNum = 0;
	private Token current;
	private final Deque<Symbol> stack = new ArrayDeque<>();

	public LLParser(LLParserTable table, Lexer lexer){
		this.table = table;
		tokens.add(lexer.cur());
		while (!lexer.cur().isEOF()){
			tokens.add(lexer.next());
		}
		current = tokens.get(0);
	}

	private void advanceTokenNum(){
		if (currentTokenNum < tokens.size() - 1){
			currentTokenNum++;
			current = tokens.get(currentTokenNum);
		}
	}

	public ParseResult parse(){
		if (!stack.isEmpty() || currentTokenNum != 0){
			throw new IllegalStateException("A parser can only be used once");
		}
		List<Production> derivation = new ArrayList<>();
		stack.push(Terminal.EOF);
		stack.push(table.grammar.getStart());
		while (true) {
			Symbol top = stack.peek();
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest(String.format("stack = %s, current = %s", stack, current));
			}
			if (top instanceof Terminal && ((Terminal) top).isEOF()){
				if (current.isEOF()){
					return ParseResult.accept(derivation);
				}
				return reject(derivation, ImmutableSet.of(Terminal.EOF));
			}
			if (top instanceof NonTerminal){
				NonTerminal nonTerminal = (NonTerminal) top;
				Optional<Production> production = table.lookup(nonTerminal, lookahead());
				if (!production.isPresent()){
					return reject(derivation, table.expectedTerminals(nonTerminal));
				}
				stack.pop();
				List<Symbol> right = production.get().right;
				for (int i = right.size() - 1; i >= 0; i--){
					if (!(right.get(i) instanceof Epsilon)){
						stack.push(right.get(i));
					}
				}
				derivation.add(production.get());
				if (LOG.isLoggable(Level.FINE)){
					LOG.fine("Expand " + production.get());
				}
			} else if (current.isTerminal((Terminal) top)){
				stack.pop();
				advanceTokenNum();
			} else {
				return reject(derivation, ImmutableSet.of((Terminal) top));
			}
		}
	}

	private Terminal lookahead(){
		return (Terminal) current.symbol;
	}

	private ParseResult reject(List<Production> derivation, ImmutableSet<Terminal> expected){
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Unexpected %s, expected %s", current, expected));
		}
		return ParseResult.reject(derivation, current, expected);
	}
}
