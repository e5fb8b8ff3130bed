package gramlab.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production {

	/**
	 * Id of the production, productions are numbered in source order
	 */
	public final int id;
	/**
	 * Left hand side of the production (the defined non terminal)
	 */
	public final Symbol left;
	/**
	 * Right hand side of the production, never contains an epsilon, empty for epsilon productions
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<Symbol> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Symbol> terminals;

	/**
	 * 0-based line of the rule in the grammar text, -1 for productions that weren't parsed from text
	 */
	public final int line;

	public Production(int id, Symbol left, List<Symbol> right, int line) {
		this.id = id;
		this.left = left;
		this.line = line;
		List<Symbol> r = new ArrayList<>();
		List<Symbol> nonTerminals = new ArrayList<>();
		List<Symbol> terminals = new ArrayList<>();
		for (Symbol symbol : right) {
			if (symbol.isEpsilon()){
				continue;
			}
			r.add(symbol);
			if (symbol.isNonTerminal()){
				nonTerminals.add(symbol);
			} else if (symbol.isTerminal()){
				terminals.add(symbol);
			}
		}
		this.right = Collections.unmodifiableList(r);
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return Symbol.EPSILON_MARKER;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return id + " " + left + " → " + formatRightSide();
	}

	/**
	 * Does the right hand side consist only of epsilon?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Does the right hand side start with the left hand side (compared by name)?
	 */
	public boolean isDirectlyLeftRecursive(){
		return !right.isEmpty() && right.get(0).name.equals(left.name);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}
}
