package gramlab.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import gramlab.lexer.LineClassifier;
import gramlab.lexer.LineClassifier.GrammarLine;
import gramlab.lexer.RhsSplitter;

/**
 * Allows the simple creation of grammars, either from grammar text or programmatically.
 *
 * The text format is line oriented:
 * <pre>
 *   start: S;
 *   S -> A 'x' | ε
 *   A → a
 * </pre>
 * Building from text never fails, lines that aren't understood are skipped.
 *
 * In the programmatic API strings are classified like tokens of the text format, so
 * <code>add("E", "E", "'+'", "T")</code> adds the production <code>E → E '+' T</code>.
 */
public class GrammarBuilder {

	private static final Logger LOG = Logger.getLogger(GrammarBuilder.class.getName());

	/**
	 * Only the beginning of a text is inspected by {@link #looksLikeGrammar(String)}
	 */
	private static final int SNIFF_LENGTH = 4000;

	private String start;
	private final List<Production> productions = new ArrayList<>();

	/**
	 * Set the start non terminal, the last call wins
	 */
	public GrammarBuilder start(String start){
		this.start = start;
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are tokens:
	 *  - uppercase names: non terminals
	 *  - "ε", "epsilon" or "": the empty word
	 *  - everything else: terminals
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, String... right){
		return add(left, -1, right);
	}

	private GrammarBuilder add(String left, int line, String... right){
		List<Symbol> symbols = new ArrayList<>();
		for (String token : right) {
			if (!token.isEmpty()){
				symbols.add(Symbol.of(token));
			}
		}
		productions.add(new Production(productions.size(), Symbol.nonTerminal(left), symbols, line));
		return this;
	}

	/**
	 * Add the productions of a rule line (all alternatives of the passed right hand side)
	 */
	public GrammarBuilder addRule(String left, String rhs, int line){
		for (List<String> tokens : RhsSplitter.split(rhs)) {
			add(left, line, tokens.toArray(new String[0]));
		}
		return this;
	}

	public Grammar toGrammar(){
		return new Grammar(start == null ? null : Symbol.nonTerminal(start), productions);
	}

	/**
	 * Parse the passed grammar text.
	 *
	 * @param text grammar text, null is treated like an empty text
	 * @return grammar, empty if nothing could be parsed
	 */
	public static Grammar build(String text){
		GrammarBuilder builder = new GrammarBuilder();
		for (GrammarLine line : LineClassifier.classifyAll(text)) {
			switch (line.type){
				case START:
					builder.start(line.name);
					break;
				case RULE:
					builder.addRule(line.name, line.rhs, line.lineNumber);
					break;
				case UNKNOWN:
					if (LOG.isLoggable(Level.FINER)){
						LOG.finer(String.format("Skipping line %d, it's neither a rule nor a start declaration", line.lineNumber));
					}
					break;
				default:
			}
		}
		return builder.toGrammar();
	}

	/**
	 * Does the beginning of the passed text look like a grammar, i.e. has it a start declaration and a rule
	 * for an uppercase non terminal?
	 */
	public static boolean looksLikeGrammar(String text){
		if (text == null){
			return false;
		}
		String head = text.length() > SNIFF_LENGTH ? text.substring(0, SNIFF_LENGTH) : text;
		boolean hasStart = false;
		boolean hasRule = false;
		for (String rawLine : LineClassifier.lines(head)) {
			String line = rawLine.trim();
			if (line.regionMatches(true, 0, LineClassifier.START_KEYWORD, 0, LineClassifier.START_KEYWORD.length())
					&& line.substring(LineClassifier.START_KEYWORD.length()).trim().startsWith(":")){
				hasStart = true;
			}
			GrammarLine grammarLine = LineClassifier.classify(line, 0);
			if (grammarLine.type == LineClassifier.Type.RULE && SymbolClassifier.isNonTerminal(grammarLine.name)
					&& line.substring(grammarLine.name.length()).trim().startsWith(LineClassifier.ARROW)){
				hasRule = true;
			}
		}
		return hasStart && hasRule;
	}
}
