package lltable.grammar;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The follow(1) sets of all non terminals of a grammar.
 *
 * Every set is ordered by the discovery of its terminals and ends with the end of input marker.
 */
public class FollowSets implements Serializable {

	private static final Logger LOG = Logger.getLogger(FollowSets.class.getName());

	private final ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets;

	private FollowSets(ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets) {
		this.sets = sets;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε
	 * is placed in FOLLOW(B). This is done once for every occurrence of B.
	 * If there is a production A → aB or a production A → aBb, where FIRST(b) contains ε, then everything in
	 * FOLLOW(A) is in FOLLOW(B). This is repeated until no follow set changes.
	 * Last, $ (the end of input marker) is appended to every follow set.
	 */
	public static FollowSets of(Grammar grammar, FirstSets first){
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.nonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		for (Production production : grammar.getProductions()){
			List<Symbol> right = production.right;
			for (int i = 0; i < right.size(); i++){
				if (right.get(i) instanceof NonTerminal){
					Set<Terminal> followSet = follow.get(right.get(i));
					for (TerminalOrEpsilon toe : first.firstOfSequence(right.subList(i + 1, right.size()))){
						if (toe instanceof Terminal){
							followSet.add((Terminal) toe);
						}
					}
				}
			}
		}
		boolean followChanged;
		do {
			followChanged = false;
			for (Production production : grammar.getProductions()){
				Set<Terminal> leftFollow = follow.get(production.left);
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (!(symbol instanceof NonTerminal)){
						break;
					}
					if (!symbol.equals(production.left) && follow.get(symbol).addAll(leftFollow)){
						followChanged = true;
					}
					if (!grammar.isEpsilonable(symbol)){
						break;
					}
				}
			}
		} while (followChanged);
		ImmutableMap.Builder<NonTerminal, ImmutableSet<Terminal>> builder = ImmutableMap.builder();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : follow.entrySet()){
			builder.put(entry.getKey(), ImmutableSet.<Terminal>builder().addAll(entry.getValue())
					.add(Terminal.EOF).build());
		}
		FollowSets followSets = new FollowSets(builder.build());
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Follow sets:\n" + followSets);
		}
		return followSets;
	}

	public ImmutableSet<Terminal> get(NonTerminal nonTerminal){
		ImmutableSet<Terminal> set = sets.get(nonTerminal);
		if (set == null){
			throw new MalformedGrammarError("No such non terminal " + nonTerminal);
		}
		return set;
	}

	public ImmutableMap<NonTerminal, ImmutableSet<Terminal>> asMap(){
		return sets;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, ImmutableSet<Terminal>> entry : sets.entrySet()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(entry.getKey()).append(" = ").append(FirstSets.format(entry.getValue()));
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FollowSets && ((FollowSets) obj).sets.equals(sets);
	}

	@Override
	public int hashCode() {
		return sets.hashCode();
	}
}
