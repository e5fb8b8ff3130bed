package gramlab.grammar;

/**
 * Kind of a grammar symbol.
 */
public enum SymbolKind {
	TERMINAL,
	NONTERMINAL,
	EPSILON,
	/**
	 * The end of input marker, only used in follow sets
	 */
	END_OF_INPUT
}
