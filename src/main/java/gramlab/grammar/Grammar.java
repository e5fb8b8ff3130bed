package gramlab.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static gramlab.util.Utils.join;

/**
 * Grammar consisting of a start symbol, productions and the sets of defined and used symbols.
 *
 * Instances are immutable, use the {@link GrammarBuilder} to create them.
 */
public class Grammar {

	private final Symbol start;

	private final List<Production> productions;

	/**
	 * Non terminals that appear on the left hand side of a production, in source order
	 */
	private final Set<Symbol> definedNonTerminals;

	/**
	 * Non terminals that appear on a right hand side
	 */
	private final Set<Symbol> usedNonTerminals;

	private final Set<Symbol> terminals;

	/**
	 * Create a new grammar object
	 *
	 * @param start start non terminal, if null the first defined non terminal is used
	 * @param productions productions in source order
	 */
	public Grammar(Symbol start, List<Production> productions) {
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		Set<Symbol> defined = new LinkedHashSet<>();
		Set<Symbol> used = new LinkedHashSet<>();
		Set<Symbol> terminals = new LinkedHashSet<>();
		for (Production production : productions) {
			defined.add(production.left);
			used.addAll(production.nonTerminals);
			terminals.addAll(production.terminals);
		}
		this.definedNonTerminals = Collections.unmodifiableSet(defined);
		this.usedNonTerminals = Collections.unmodifiableSet(used);
		this.terminals = Collections.unmodifiableSet(terminals);
		if (start == null && !defined.isEmpty()){
			start = defined.iterator().next();
		}
		this.start = start;
	}

	/**
	 * @return start non terminal or null if the grammar is empty and declares none
	 */
	public Symbol getStart(){
		return start;
	}

	public boolean hasStart(){
		return start != null;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public List<Production> getProductionsOf(Symbol nonTerminal){
		return getProductionsOf(nonTerminal.name);
	}

	/**
	 * Productions whose left hand side has the passed name, in source order
	 */
	public List<Production> getProductionsOf(String name){
		List<Production> ret = new ArrayList<>();
		for (Production production : productions) {
			if (production.left.name.equals(name)) {
				ret.add(production);
			}
		}
		return ret;
	}

	public Set<Symbol> getDefinedNonTerminals() {
		return definedNonTerminals;
	}

	public Set<Symbol> getUsedNonTerminals() {
		return usedNonTerminals;
	}

	public Set<Symbol> getTerminals() {
		return terminals;
	}

	/**
	 * Defined and used non terminals (and the start symbol), defined ones first
	 */
	public Set<Symbol> getNonTerminals(){
		Set<Symbol> ret = new LinkedHashSet<>(definedNonTerminals);
		ret.addAll(usedNonTerminals);
		if (start != null){
			ret.add(start);
		}
		return ret;
	}

	public boolean isDefined(String name){
		for (Symbol symbol : definedNonTerminals) {
			if (symbol.name.equals(name)){
				return true;
			}
		}
		return false;
	}

	/**
	 * Used non terminals without a production
	 */
	public Set<Symbol> getUndefinedNonTerminals(){
		Set<Symbol> ret = new LinkedHashSet<>(usedNonTerminals);
		ret.removeAll(definedNonTerminals);
		return ret;
	}

	public boolean isEmpty(){
		return productions.isEmpty();
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + definedNonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return longDescription();
	}
}
