package lltable.grammar;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import lltable.util.Utils;

/**
 * The first(1) sets of all non terminals of a grammar.
 *
 * Every set is ordered by the discovery of its elements and contains ε if the non terminal is epsilonable.
 * For a corrected grammar with a single production per non terminal every set consists of exactly one terminal.
 */
public class FirstSets implements Serializable {

	private static final Logger LOG = Logger.getLogger(FirstSets.class.getName());

	private final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableSet<TerminalOrEpsilon>> sets;

	private FirstSets(Grammar grammar, ImmutableMap<NonTerminal, ImmutableSet<TerminalOrEpsilon>> sets) {
		this.grammar = grammar;
		this.sets = sets;
	}

	/**
	 * Calculates the first sets.
	 *
	 * First the chains of leading non terminals are followed, every chain has to end in a terminal or ε.
	 * Then the first set of each non terminal is the union of the first sets of its productions, computed by
	 * iterating until no set changes anymore.
	 *
	 * @throws CyclicFirstChainError if a chain of leading non terminals reaches a non terminal twice
	 */
	public static FirstSets of(Grammar grammar){
		checkLeadingChains(grammar);
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.nonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Production production : grammar.getProductions()){
				Set<TerminalOrEpsilon> productionFirst = firstOfSequence(grammar, first, production.right);
				firstChanged = first.get(production.left).addAll(productionFirst) || firstChanged;
			}
		} while (firstChanged);
		ImmutableMap.Builder<NonTerminal, ImmutableSet<TerminalOrEpsilon>> builder = ImmutableMap.builder();
		for (Map.Entry<NonTerminal, Set<TerminalOrEpsilon>> entry : first.entrySet()){
			builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
		}
		FirstSets firstSets = new FirstSets(grammar, builder.build());
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("First sets:\n" + firstSets);
		}
		return firstSets;
	}

	private static Set<TerminalOrEpsilon> firstOfSequence(Grammar grammar,
	                                                      Map<NonTerminal, ? extends Set<TerminalOrEpsilon>> first,
	                                                      List<Symbol> term){
		Set<TerminalOrEpsilon> set = new LinkedHashSet<>();
		for (Symbol symbol : term){
			if (symbol instanceof Terminal){
				set.add((Terminal) symbol);
				return set;
			}
			if (symbol instanceof NonTerminal){
				for (TerminalOrEpsilon toe : first.get(symbol)){
					if (toe instanceof Terminal){
						set.add(toe);
					}
				}
				if (!grammar.isEpsilonable(symbol)){
					return set;
				}
			}
		}
		set.add(new Epsilon());
		return set;
	}

	/**
	 * Follows the chains of leading non terminals depth first, remembering the current path.
	 */
	private static void checkLeadingChains(Grammar grammar){
		Set<NonTerminal> finished = new HashSet<>();
		for (NonTerminal nonTerminal : grammar.nonTerminals()){
			followChain(grammar, nonTerminal, new ArrayList<>(), finished);
		}
	}

	private static void followChain(Grammar grammar, NonTerminal nonTerminal, List<NonTerminal> path,
	                                Set<NonTerminal> finished){
		if (finished.contains(nonTerminal)){
			return;
		}
		int index = path.indexOf(nonTerminal);
		if (index != -1){
			List<NonTerminal> cycle = new ArrayList<>(path.subList(index, path.size()));
			cycle.add(nonTerminal);
			throw new CyclicFirstChainError(cycle);
		}
		path.add(nonTerminal);
		for (NonTerminal leading : leadingNonTerminals(grammar, nonTerminal)){
			followChain(grammar, leading, path, finished);
		}
		path.remove(path.size() - 1);
		finished.add(nonTerminal);
	}

	/**
	 * Non terminals that can be the first symbol of a production of the passed non terminal: the first symbol and
	 * every non terminal that is only preceded by epsilonable non terminals.
	 */
	private static Set<NonTerminal> leadingNonTerminals(Grammar grammar, NonTerminal nonTerminal){
		Set<NonTerminal> leading = new LinkedHashSet<>();
		for (Production production : grammar.getProductions(nonTerminal)){
			for (Symbol symbol : production.right){
				if (symbol instanceof Terminal){
					break;
				}
				if (symbol instanceof NonTerminal){
					leading.add((NonTerminal) symbol);
					if (!grammar.isEpsilonable(symbol)){
						break;
					}
				}
			}
		}
		return leading;
	}

	/**
	 * First set of the passed sequence of symbols, contains ε if the whole sequence is epsilonable.
	 */
	public ImmutableSet<TerminalOrEpsilon> firstOfSequence(List<Symbol> term){
		return ImmutableSet.copyOf(firstOfSequence(grammar, sets, term));
	}

	public ImmutableSet<TerminalOrEpsilon> get(NonTerminal nonTerminal){
		ImmutableSet<TerminalOrEpsilon> set = sets.get(nonTerminal);
		if (set == null){
			throw new MalformedGrammarError("No such non terminal " + nonTerminal);
		}
		return set;
	}

	/**
	 * The single terminal that starts every derivation of the passed non terminal.
	 *
	 * @throws IllegalStateException if the first set doesn't consist of exactly one terminal
	 */
	public Terminal first(NonTerminal nonTerminal){
		ImmutableSet<TerminalOrEpsilon> set = get(nonTerminal);
		if (set.size() != 1 || !(set.iterator().next() instanceof Terminal)){
			throw new IllegalStateException(String.format("First set of %s isn't a single terminal: %s", nonTerminal,
					format(set)));
		}
		return (Terminal) set.iterator().next();
	}

	public boolean isEpsilonable(Symbol symbol){
		return grammar.isEpsilonable(symbol);
	}

	public ImmutableMap<NonTerminal, ImmutableSet<TerminalOrEpsilon>> asMap(){
		return sets;
	}

	static String format(Collection<? extends TerminalOrEpsilon> set){
		return Utils.join(set, ",");
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, ImmutableSet<TerminalOrEpsilon>> entry : sets.entrySet()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(entry.getKey()).append(" = ").append(format(entry.getValue()));
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FirstSets && ((FirstSets) obj).sets.equals(sets);
	}

	@Override
	public int hashCode() {
		return sets.hashCode();
	}
}
