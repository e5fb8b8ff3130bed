package gramlab.diagnostics;

import java.util.List;
import java.util.Set;

import gramlab.grammar.Grammar;
import gramlab.grammar.GrammarBuilder;
import gramlab.grammar.Production;
import gramlab.grammar.Symbol;
import gramlab.lexer.LineClassifier;
import gramlab.lexer.Range;

/**
 * Sanity checks for grammars: undefined non terminals, unreachable non terminals and
 * direct left recursion.
 *
 * Indirect left recursion (like <code>A → B x, B → A y</code>) isn't detected.
 */
public class GrammarChecker {

	/**
	 * Left recursion diagnostics span the columns 0 to 80 of their line
	 */
	public static final int LEFT_RECURSION_END_COLUMN = 80;

	private static final Range FALLBACK_RANGE = Range.onLine(0, 0, 1);

	private final Grammar grammar;
	private final List<String> lines;
	private final DiagnosticPipe diagnostics = new DiagnosticPipe();

	private GrammarChecker(Grammar grammar, String text) {
		this.grammar = grammar;
		this.lines = LineClassifier.lines(text);
	}

	/**
	 * Parse and check the passed grammar text
	 */
	public static DiagnosticPipe diagnose(String text){
		return diagnose(GrammarBuilder.build(text), text);
	}

	/**
	 * Check the passed grammar
	 *
	 * @param text the text the grammar was built from, used to locate the problems
	 */
	public static DiagnosticPipe diagnose(Grammar grammar, String text){
		GrammarChecker checker = new GrammarChecker(grammar, text);
		checker.checkUndefined();
		checker.checkUnreachable();
		checker.checkLeftRecursion();
		return checker.diagnostics;
	}

	private void checkUndefined(){
		for (Symbol symbol : grammar.getUndefinedNonTerminals()) {
			diagnostics.add(Diagnostic.error(String.format("Undefined nonterminal '%s'", symbol.name),
					firstOccurrence(symbol.name)));
		}
	}

	private void checkUnreachable(){
		if (!grammar.hasStart()){
			return;
		}
		Set<String> reached = DependencyGraph.of(grammar).reachableFrom(grammar.getStart().name);
		for (Symbol symbol : grammar.getDefinedNonTerminals()) {
			if (!reached.contains(symbol.name)){
				Production first = grammar.getProductionsOf(symbol).get(0);
				diagnostics.add(Diagnostic.warning(String.format("Unreachable nonterminal '%s'", symbol.name),
						wholeLine(first.line)));
			}
		}
	}

	private void checkLeftRecursion(){
		for (Production production : grammar.getProductions()) {
			if (production.isDirectlyLeftRecursive()){
				diagnostics.add(Diagnostic.error(String.format("Direct left recursion on '%s'", production.left.name),
						Range.onLine(Math.max(production.line, 0), 0, LEFT_RECURSION_END_COLUMN)));
			}
		}
	}

	/**
	 * First textual occurrence of the word, even as part of another word or inside a comment
	 */
	private Range firstOccurrence(String word){
		for (int i = 0; i < lines.size(); i++) {
			int index = lines.get(i).indexOf(word);
			if (index >= 0){
				return Range.onLine(i, index, index + word.length());
			}
		}
		return FALLBACK_RANGE;
	}

	private Range wholeLine(int line){
		if (line < 0 || line >= lines.size()){
			return FALLBACK_RANGE;
		}
		return Range.onLine(line, 0, lines.get(line).length());
	}
}
