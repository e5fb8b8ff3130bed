package gramlab.grammar;

import java.util.Comparator;
import java.util.Objects;

/**
 * An immutable grammar symbol: the token text together with its kind.
 *
 * Two symbols are equal if they have the same name and kind.
 */
public final class Symbol implements Comparable<Symbol> {

	public static final String EPSILON_MARKER = "ε";
	public static final String END_OF_INPUT_MARKER = "$";

	public static final Symbol EPSILON = new Symbol(EPSILON_MARKER, SymbolKind.EPSILON);
	public static final Symbol END_OF_INPUT = new Symbol(END_OF_INPUT_MARKER, SymbolKind.END_OF_INPUT);

	/**
	 * Markers (ε and $) first, then lexicographic by name.
	 */
	public static final Comparator<Symbol> PRESENTATION_ORDER = Comparator
			.comparing((Symbol s) -> !s.isMarker())
			.thenComparing(s -> s.name)
			.thenComparing(s -> s.kind);

	public final String name;
	public final SymbolKind kind;

	private Symbol(String name, SymbolKind kind) {
		this.name = name;
		this.kind = kind;
	}

	/**
	 * Create the symbol for the passed token, classified by its lexical shape.
	 */
	public static Symbol of(String token){
		SymbolKind kind = SymbolClassifier.classify(token);
		if (kind == SymbolKind.EPSILON){
			return EPSILON;
		}
		return new Symbol(token, kind);
	}

	public static Symbol nonTerminal(String name){
		return new Symbol(name, SymbolKind.NONTERMINAL);
	}

	public static Symbol terminal(String name){
		return new Symbol(name, SymbolKind.TERMINAL);
	}

	public boolean isTerminal(){
		return kind == SymbolKind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind == SymbolKind.NONTERMINAL;
	}

	public boolean isEpsilon(){
		return kind == SymbolKind.EPSILON;
	}

	public boolean isEndOfInput(){
		return kind == SymbolKind.END_OF_INPUT;
	}

	/**
	 * Is this ε or $?
	 */
	public boolean isMarker(){
		return isEpsilon() || isEndOfInput();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj){
			return true;
		}
		if (!(obj instanceof Symbol)){
			return false;
		}
		Symbol other = (Symbol)obj;
		return kind == other.kind && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind);
	}

	@Override
	public int compareTo(Symbol o) {
		return PRESENTATION_ORDER.compare(this, o);
	}

	@Override
	public String toString() {
		return name;
	}
}
