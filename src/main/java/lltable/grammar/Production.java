package lltable.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import lltable.util.Utils;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, its position in the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production. Contains exactly one epsilon if the production derives the empty word,
	 * no epsilon otherwise.
	 */
	public final ImmutableList<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final ImmutableList<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final ImmutableList<Terminal> terminals;

	public Production(int id, NonTerminal left, List<? extends Symbol> right) {
		this.id = id;
		this.left = left;
		List<Symbol> r = new ArrayList<>();
		for (Symbol sym : right){
			if (!(sym instanceof Epsilon)){
				r.add(sym);
			}
		}
		if (r.isEmpty()){
			r.add(new Epsilon());
		}
		this.right = ImmutableList.copyOf(r);
		ImmutableList.Builder<NonTerminal> nonTerminals = ImmutableList.builder();
		ImmutableList.Builder<Terminal> terminals = ImmutableList.builder();
		for (Symbol symbol : r) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal) symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			}
		}
		this.nonTerminals = nonTerminals.build();
		this.terminals = terminals.build();
	}

	/**
	 * Copy of this production with another id.
	 */
	public Production withId(int newId){
		return new Production(newId, left, right);
	}

	public String formatRightSide(){
		return Utils.join(right, " ");
	}

	@Override
	public String toString() {
		return left + " → " + formatRightSide();
	}

	/**
	 * Does this production derive the empty word directly?
	 */
	public boolean isEpsilonProduction(){
		return right.get(0) instanceof Epsilon;
	}

	/**
	 * Has this production the same left and right hand side as the passed one?
	 */
	public boolean sameRule(Production other){
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production) obj).id == id && sameRule((Production) obj);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, left, right);
	}
}
