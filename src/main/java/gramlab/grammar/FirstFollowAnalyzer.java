package gramlab.grammar;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calculates the nullable non terminals and the first(k=1) and follow(k=1) sets of a grammar.
 *
 * All three are computed together in a single fix point iteration, every pass
 * <ol>
 *     <li>marks a non terminal A as nullable if it has a production A → α with
 *     α = ε or α consisting only of nullable non terminals</li>
 *     <li>adds FIRST(α) to FIRST(A) for every production A → α</li>
 *     <li>for every production A → αBβ (B a non terminal) adds FIRST(β) - {ε} to FOLLOW(B)
 *     and FOLLOW(A) to FOLLOW(B) if β is ε or FIRST(β) contains ε</li>
 * </ol>
 * The sets only grow and are bounded by the symbols of the grammar, therefore the iteration stops.
 * FOLLOW(S) of the start symbol S initially contains the end of input marker $, unless no production
 * mentions S.
 */
public class FirstFollowAnalyzer {

	private static final Logger LOG = Logger.getLogger(FirstFollowAnalyzer.class.getName());

	private final Grammar grammar;
	private final Set<Symbol> nullable = new HashSet<>();
	private final Map<Symbol, Set<Symbol>> first = new HashMap<>();
	private final Map<Symbol, Set<Symbol>> follow = new HashMap<>();

	private FirstFollowAnalyzer(Grammar grammar) {
		this.grammar = grammar;
		for (Symbol nonTerminal : grammar.getNonTerminals()) {
			first.put(nonTerminal, new HashSet<>());
			follow.put(nonTerminal, new HashSet<>());
		}
		Symbol start = grammar.getStart();
		if (start != null && (grammar.getDefinedNonTerminals().contains(start) || grammar.getUsedNonTerminals().contains(start))){
			follow.get(start).add(Symbol.END_OF_INPUT);
		}
	}

	/**
	 * Analyze the passed grammar, the result is owned by the caller.
	 */
	public static FirstFollowSets analyze(Grammar grammar){
		return new FirstFollowAnalyzer(grammar).run();
	}

	private FirstFollowSets run(){
		int passes = 0;
		boolean somethingChanged;
		do {
			somethingChanged = updateNullable();
			somethingChanged = updateFirst() || somethingChanged;
			somethingChanged = updateFollow() || somethingChanged;
			passes++;
		} while (somethingChanged);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Fix point reached after %d passes for %d productions", passes,
					grammar.getProductions().size()));
		}
		return new FirstFollowSets(nullable, first, follow);
	}

	private boolean updateNullable(){
		boolean somethingChanged = false;
		for (Production production : grammar.getProductions()) {
			if (nullable.contains(production.left)){
				continue;
			}
			boolean allNullable = true;
			for (Symbol symbol : production.right) {
				if (!symbol.isNonTerminal() || !nullable.contains(symbol)){
					allNullable = false;
					break;
				}
			}
			if (allNullable){
				somethingChanged = nullable.add(production.left) || somethingChanged;
			}
		}
		return somethingChanged;
	}

	private boolean updateFirst(){
		boolean somethingChanged = false;
		for (Production production : grammar.getProductions()) {
			Set<Symbol> firstOfRight = firstOf(first, production.right);
			somethingChanged = first.get(production.left).addAll(firstOfRight) || somethingChanged;
		}
		return somethingChanged;
	}

	private boolean updateFollow(){
		boolean somethingChanged = false;
		for (Production production : grammar.getProductions()) {
			List<Symbol> right = production.right;
			for (int i = 0; i < right.size(); i++) {
				Symbol symbol = right.get(i);
				if (!symbol.isNonTerminal()){
					continue;
				}
				Set<Symbol> followSet = follow.get(symbol);
				Set<Symbol> firstOfRest = firstOf(first, right.subList(i + 1, right.size()));
				for (Symbol sym : firstOfRest) {
					if (!sym.isEpsilon()){
						somethingChanged = followSet.add(sym) || somethingChanged;
					}
				}
				if (firstOfRest.contains(Symbol.EPSILON)){
					somethingChanged = followSet.addAll(follow.get(production.left)) || somethingChanged;
				}
			}
		}
		return somethingChanged;
	}

	/**
	 * First set of a symbol sequence, contains ε if the whole sequence can derive ε.
	 *
	 * @param first current first sets of the non terminals
	 * @param term symbol sequence
	 */
	static Set<Symbol> firstOf(Map<Symbol, Set<Symbol>> first, List<Symbol> term){
		Set<Symbol> set = new HashSet<>();
		for (Symbol symbol : term) {
			if (symbol.isEpsilon()){
				continue;
			}
			if (!symbol.isNonTerminal()){
				set.add(symbol);
				return set;
			}
			Set<Symbol> firstOfSymbol = first.getOrDefault(symbol, new HashSet<>());
			for (Symbol sym : firstOfSymbol) {
				if (!sym.isEpsilon()){
					set.add(sym);
				}
			}
			if (!firstOfSymbol.contains(Symbol.EPSILON)){
				return set;
			}
		}
		set.add(Symbol.EPSILON);
		return set;
	}
}
