package lltable.parser;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;

import lltable.Config;
import lltable.grammar.*;

/**
 * LL(1) parser table: maps a non terminal and a lookahead terminal to the production that has to be expanded.
 * Missing entries mean that the input has to be rejected.
 */
public class LLParserTable implements Serializable {

	private static final Logger LOG = Logger.getLogger(LLParserTable.class.getName());

	public final Grammar grammar;

	private final ImmutableTable<NonTerminal, Terminal, Production> table;

	private LLParserTable(Grammar grammar, ImmutableTable<NonTerminal, Terminal, Production> table){
		this.grammar = grammar;
		this.table = table;
	}

	/**
	 * Builds the table for the passed grammar, the handling of conflicts depends on the configuration.
	 *
	 * @see Config#failOnConflict()
	 */
	public static LLParserTable fromGrammar(Grammar grammar){
		FirstSets first = FirstSets.of(grammar);
		return fromGrammar(grammar, first, FollowSets.of(grammar, first), Config.failOnConflict());
	}

	/**
	 * Builds the table: a production A → α is used for every terminal in FIRST(α) and, if α is epsilonable, for
	 * every terminal in FOLLOW(A).
	 *
	 * @param failOnConflict throw an error on a conflict? Otherwise the conflict is logged and the later production
	 *                       is used
	 * @throws LLConflictError if two productions would be used for the same entry and failOnConflict is set
	 */
	public static LLParserTable fromGrammar(Grammar grammar, FirstSets first, FollowSets follow,
	                                        boolean failOnConflict){
		Table<NonTerminal, Terminal, Production> table =
				Tables.newCustomTable(new LinkedHashMap<NonTerminal, Map<Terminal, Production>>(), LinkedHashMap::new);
		for (Production production : grammar.getProductions()){
			Set<TerminalOrEpsilon> productionFirst = first.firstOfSequence(production.right);
			for (TerminalOrEpsilon toe : productionFirst){
				if (toe instanceof Terminal){
					insertAction(table, production.left, (Terminal) toe, production, failOnConflict);
				}
			}
			if (productionFirst.contains(new Epsilon())){
				for (Terminal lookahead : follow.get(production.left)){
					insertAction(table, production.left, lookahead, production, failOnConflict);
				}
			}
		}
		LLParserTable llTable = new LLParserTable(grammar, ImmutableTable.copyOf(table));
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Parser table:\n" + llTable);
		}
		return llTable;
	}

	private static void insertAction(Table<NonTerminal, Terminal, Production> table, NonTerminal nonTerminal,
	                                 Terminal lookahead, Production executedProduction, boolean failOnConflict){
		Production existing = table.get(nonTerminal, lookahead);
		if (existing != null && !existing.equals(executedProduction)){
			if (failOnConflict){
				throw new LLConflictError(nonTerminal, lookahead, existing, executedProduction);
			}
			LOG.warning(String.format("Conflict between %s and %s at lookahead token %s, the second production " +
					"will be used", existing, executedProduction, lookahead));
		}
		table.put(nonTerminal, lookahead, executedProduction);
	}

	/**
	 * Production to expand for the passed non terminal and lookahead, empty if the input has to be rejected.
	 */
	public Optional<Production> lookup(NonTerminal nonTerminal, Terminal lookahead){
		return Optional.ofNullable(table.get(nonTerminal, lookahead));
	}

	public boolean hasEntry(NonTerminal nonTerminal, Terminal lookahead){
		return table.contains(nonTerminal, lookahead);
	}

	public ImmutableMap<Terminal, Production> row(NonTerminal nonTerminal){
		return table.row(nonTerminal);
	}

	/**
	 * Terminals with an entry in the row of the passed non terminal, ordered like the terminals of the grammar.
	 */
	public ImmutableSet<Terminal> expectedTerminals(NonTerminal nonTerminal){
		ImmutableSet.Builder<Terminal> builder = ImmutableSet.builder();
		for (Terminal terminal : grammar.terminals()){
			if (table.contains(nonTerminal, terminal)){
				builder.add(terminal);
			}
		}
		return builder.build();
	}

	public ImmutableTable<NonTerminal, Terminal, Production> getTable(){
		return table;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : grammar.nonTerminals()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append(nonTerminal).append(" = {");
			for (Terminal terminal : expectedTerminals(nonTerminal)){
				builder.append(" ").append(terminal).append(" = { ")
						.append(table.get(nonTerminal, terminal).formatRightSide()).append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LLParserTable && ((LLParserTable) obj).grammar.equals(grammar)
				&& ((LLParserTable) obj).table.equals(table);
	}

	@Override
	public int hashCode() {
		return table.hashCode();
	}
}
