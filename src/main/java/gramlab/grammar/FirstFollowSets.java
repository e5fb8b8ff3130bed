package gramlab.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static gramlab.util.Utils.join;

/**
 * Result of the {@link FirstFollowAnalyzer}: nullable non terminals, first(1) and follow(1) sets.
 *
 * First sets contain terminals and ε, follow sets terminals and $. The sets are unordered,
 * use {@link #sorted(Set)} or {@link #format()} for reproducible output.
 */
public class FirstFollowSets {

	private final Set<Symbol> nullable;
	private final Map<Symbol, Set<Symbol>> first;
	private final Map<Symbol, Set<Symbol>> follow;

	FirstFollowSets(Set<Symbol> nullable, Map<Symbol, Set<Symbol>> first, Map<Symbol, Set<Symbol>> follow) {
		this.nullable = Collections.unmodifiableSet(new LinkedHashSet<>(sorted(nullable)));
		this.first = freeze(first);
		this.follow = freeze(follow);
	}

	private static Map<Symbol, Set<Symbol>> freeze(Map<Symbol, Set<Symbol>> map){
		Map<Symbol, Set<Symbol>> ret = new LinkedHashMap<>();
		for (Symbol key : sorted(map.keySet())) {
			ret.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(sorted(map.get(key)))));
		}
		return Collections.unmodifiableMap(ret);
	}

	public Set<Symbol> getNullable() {
		return nullable;
	}

	public Map<Symbol, Set<Symbol>> getFirst() {
		return first;
	}

	public Map<Symbol, Set<Symbol>> getFollow() {
		return follow;
	}

	public boolean isNullable(String nonTerminal){
		return nullable.contains(Symbol.nonTerminal(nonTerminal));
	}

	/**
	 * @return first set of the non terminal, empty if the grammar doesn't know it
	 */
	public Set<Symbol> first(String nonTerminal){
		return first.getOrDefault(Symbol.nonTerminal(nonTerminal), Collections.emptySet());
	}

	/**
	 * @return follow set of the non terminal, empty if the grammar doesn't know it
	 */
	public Set<Symbol> follow(String nonTerminal){
		return follow.getOrDefault(Symbol.nonTerminal(nonTerminal), Collections.emptySet());
	}

	/**
	 * First set of the passed symbol sequence based on the calculated sets
	 */
	public Set<Symbol> firstOf(List<Symbol> term){
		return FirstFollowAnalyzer.firstOf(first, term);
	}

	/**
	 * Sort markers (ε, $) first and the rest lexicographically
	 */
	public static List<Symbol> sorted(Set<Symbol> set){
		return gramlab.util.Utils.sorted(set);
	}

	/**
	 * Renders the nullable set and one table per set, each row has the form <code>A: {a, b}</code>,
	 * empty sets are rendered as <code>∅</code>.
	 */
	public String format(){
		StringBuilder builder = new StringBuilder();
		builder.append("Nullable: ").append(formatSet(nullable)).append("\n");
		builder.append("FIRST:\n");
		formatTable(builder, first);
		builder.append("FOLLOW:\n");
		formatTable(builder, follow);
		return builder.toString();
	}

	private static void formatTable(StringBuilder builder, Map<Symbol, Set<Symbol>> table){
		for (Map.Entry<Symbol, Set<Symbol>> entry : table.entrySet()) {
			builder.append("  ").append(entry.getKey()).append(": ").append(formatSet(entry.getValue())).append("\n");
		}
	}

	private static String formatSet(Set<Symbol> set){
		if (set.isEmpty()){
			return "∅";
		}
		return "{" + join(sorted(set), ", ") + "}";
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FirstFollowSets)){
			return false;
		}
		FirstFollowSets other = (FirstFollowSets)obj;
		return nullable.equals(other.nullable) && first.equals(other.first) && follow.equals(other.follow);
	}

	@Override
	public int hashCode() {
		return nullable.hashCode() ^ first.hashCode() ^ follow.hashCode();
	}

	@Override
	public String toString() {
		return format();
	}
}
