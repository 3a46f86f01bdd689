package lltable.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

import static lltable.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions. Instances are immutable.
 *
 * Use the GrammarBuilder to build a grammar instance properly.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	private static final Logger LOG = Logger.getLogger(Grammar.class.getName());

	private final NonTerminal start;

	private final ImmutableList<Production> productions;

	/**
	 * Productions per non terminal, the keys are ordered like {@link #nonTerminals}
	 */
	private final ImmutableListMultimap<NonTerminal, Production> productionsPerNonTerminal;

	/**
	 * Non terminals in declaration order, starting with the start non terminal
	 */
	private final ImmutableSet<NonTerminal> nonTerminals;

	/**
	 * Terminals in order of their first occurrence, followed by the end of input marker
	 */
	private final ImmutableSet<Terminal> terminals;

	private transient Set<NonTerminal> epsilonableNonTerminals;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate productions and renumbers the remaining ones in their order.
	 *
	 * @param start start non terminal
	 * @param productions productions in declaration order
	 * @throws MalformedGrammarError if there are no productions for the start non terminal or an undefined non
	 *                               terminal is used
	 */
	public Grammar(NonTerminal start, List<Production> productions) {
		this.start = Objects.requireNonNull(start);
		this.productions = removeDuplicateProductions(productions);
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		nonTerminals.add(start);
		for (Production production : this.productions){
			nonTerminals.add(production.left);
		}
		this.nonTerminals = ImmutableSet.copyOf(nonTerminals);
		ImmutableListMultimap.Builder<NonTerminal, Production> perNonTerminal = ImmutableListMultimap.builder();
		for (NonTerminal nonTerminal : nonTerminals){
			for (Production production : this.productions){
				if (production.left.equals(nonTerminal)){
					perNonTerminal.put(nonTerminal, production);
				}
			}
		}
		this.productionsPerNonTerminal = perNonTerminal.build();
		if (!productionsPerNonTerminal.containsKey(start)){
			throw new MalformedGrammarError(String.format("The start non terminal %s has no productions", start));
		}
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (Production production : this.productions){
			for (NonTerminal used : production.nonTerminals){
				if (!productionsPerNonTerminal.containsKey(used)){
					throw new MalformedGrammarError(String.format("Undefined non terminal %s used in %s", used,
							production));
				}
			}
			terminals.addAll(production.terminals);
		}
		terminals.add(Terminal.EOF);
		this.terminals = ImmutableSet.copyOf(terminals);
	}

	private static ImmutableList<Production> removeDuplicateProductions(List<Production> productions){
		List<Production> unique = new ArrayList<>();
		for (Production production : productions){
			boolean duplicate = false;
			for (Production other : unique){
				if (other.sameRule(production)){
					duplicate = true;
					break;
				}
			}
			if (!duplicate){
				unique.add(production);
			}
		}
		ImmutableList.Builder<Production> renumbered = ImmutableList.builder();
		for (int i = 0; i < unique.size(); i++){
			Production production = unique.get(i);
			renumbered.add(production.id == i ? production : production.withId(i));
		}
		return renumbered.build();
	}

	/**
	 * Removes every non terminal whose only production is an epsilon production.
	 *
	 * The removed non terminals are deleted from all other right hand sides (they are not replaced by anything).
	 * A right hand side that becomes empty this way is an epsilon production afterwards, so the removal is
	 * repeated until no such non terminal is left. The start non terminal is never removed.
	 *
	 * @return corrected grammar, this grammar if nothing had to be removed
	 */
	public Grammar correct(){
		Grammar current = this;
		Set<NonTerminal> removable;
		while (!(removable = current.epsilonOnlyNonTerminals()).isEmpty()){
			if (LOG.isLoggable(Level.FINE)){
				LOG.fine("Removing epsilon only non terminals " + removable);
			}
			current = current.without(removable);
		}
		return current;
	}

	private Set<NonTerminal> epsilonOnlyNonTerminals(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : nonTerminals){
			if (nonTerminal.equals(start)){
				continue;
			}
			boolean onlyEpsilon = true;
			for (Production production : getProductions(nonTerminal)){
				onlyEpsilon = onlyEpsilon && production.isEpsilonProduction();
			}
			if (onlyEpsilon){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}

	private Grammar without(Set<NonTerminal> removed){
		List<Production> newProductions = new ArrayList<>();
		for (Production production : productions){
			if (removed.contains(production.left)){
				continue;
			}
			List<Symbol> right = new ArrayList<>(production.right);
			right.removeAll(removed);
			newProductions.add(new Production(newProductions.size(), production.left, right));
		}
		return new Grammar(start, newProductions);
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	public Set<NonTerminal> calculateEpsilonable(){
		if (epsilonableNonTerminals != null){
			return epsilonableNonTerminals;
		}
		Set<NonTerminal> epsSet = new HashSet<>();
		Set<Production> currentProds = new LinkedHashSet<>(productions);
		for (Production prod : productions) {
			if (prod.isEpsilonProduction()){
				epsSet.add(prod.left);
				currentProds.remove(prod);
			}
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : currentProds) {
				if (prod.terminals.isEmpty() && epsSet.containsAll(prod.nonTerminals)){
					somethingChanged = epsSet.add(prod.left) || somethingChanged;
				}
			}
		} while (somethingChanged);
		epsilonableNonTerminals = ImmutableSet.copyOf(epsSet);
		return epsilonableNonTerminals;
	}

	public boolean isEpsilonable(Symbol symbol){
		return symbol instanceof Epsilon || calculateEpsilonable().contains(symbol);
	}

	public NonTerminal getStart(){
		return start;
	}

	public ImmutableList<Production> getProductions(){
		return productions;
	}

	public ImmutableList<Production> getProductions(NonTerminal nonTerminal){
		return productionsPerNonTerminal.get(nonTerminal);
	}

	/**
	 * Non terminals in declaration order, the start non terminal is the first one.
	 */
	public ImmutableSet<NonTerminal> nonTerminals(){
		return nonTerminals;
	}

	/**
	 * Terminals in order of their first occurrence in the productions, the end of input marker is the last one.
	 */
	public ImmutableSet<Terminal> terminals(){
		return terminals;
	}

	public NonTerminal getNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (nonTerminal.name.equals(name)){
				return nonTerminal;
			}
		}
		throw new MalformedGrammarError("No such non terminal " + name);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + join(nonTerminals, ", ") + "\n" +
				"Terminals: " + join(terminals, ", ") + "\n" +
				"Productions: \n" + this;
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar) obj;
		return start.equals(other.start) && productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, productions);
	}
}
