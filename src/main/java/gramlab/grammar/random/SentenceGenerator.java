package gramlab.grammar.random;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gramlab.grammar.Grammar;
import gramlab.grammar.GrammarBuilder;
import gramlab.grammar.Production;
import gramlab.grammar.Symbol;
import gramlab.grammar.SymbolClassifier;

/**
 * A generator of random example sentences for a given grammar.
 *
 * Every symbol is expanded recursively, the depth of a symbol is the number of expansions above it.
 * Beyond the maximum depth non terminals aren't expanded anymore but replaced by a minimal sample
 * of the {@link GenerationPolicy}, this bounds the recursion. Beyond a smaller threshold the
 * choice of alternatives is biased towards short and not left recursive ones.
 *
 * The generator never fails, for every input it returns a (possibly empty) string.
 */
public class SentenceGenerator {

	private static final Logger LOG = Logger.getLogger(SentenceGenerator.class.getName());

	public static final String DEFAULT_START = "start";
	public static final int DEFAULT_MAX_DEPTH = 6;

	/**
	 * Beyond this depth only the shorter half of the alternatives is considered
	 */
	public static final int SHRINK_DEPTH = 3;

	public static final int MIN_STATEMENTS = 2;
	public static final int MAX_STATEMENTS = 4;

	public static final String STATEMENT_TERMINATOR = ";";

	private final SampleValues values;
	private final GenerationPolicy policy;

	public SentenceGenerator() {
		this(new Random());
	}

	public SentenceGenerator(Random random) {
		this(random, GenerationPolicy.conventional());
	}

	public SentenceGenerator(Random random, GenerationPolicy policy) {
		this.values = new SampleValues(random);
		this.policy = policy;
	}

	public String generate(String grammarText){
		return generate(grammarText, DEFAULT_START, DEFAULT_MAX_DEPTH);
	}

	/**
	 * Generate a sentence for the passed grammar text
	 *
	 * @param grammarText grammar, parsed with {@link GrammarBuilder#build(String)}
	 * @param startName name of the start non terminal, matched ignoring case
	 * @param maxDepth maximum depth of expanded non terminals
	 */
	public String generate(String grammarText, String startName, int maxDepth){
		return generate(GrammarBuilder.build(grammarText), startName, maxDepth);
	}

	public String generate(Grammar grammar, String startName, int maxDepth){
		Expansion expansion = new Expansion(grammar, maxDepth);
		String statement = policy.statementName();
		String statementList = policy.statementListName();
		if (statement != null && statementList != null
				&& grammar.isDefined(statement) && grammar.isDefined(statementList)){
			return generateProgram(expansion, statement);
		}
		return expansion.expand(resolveStart(grammar, startName), 0);
	}

	/**
	 * Generate several sentences
	 */
	public List<String> generateSamples(String grammarText, int count, String startName, int maxDepth){
		Grammar grammar = GrammarBuilder.build(grammarText);
		List<String> samples = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			samples.add(generate(grammar, startName, maxDepth));
		}
		return samples;
	}

	/**
	 * Samples with a <code>// Generated examples (N)</code> header
	 */
	public static String formatSamples(List<String> samples){
		return String.format("// Generated examples (%d)\n\n", samples.size()) + String.join("\n", samples);
	}

	/**
	 * Between {@link #MIN_STATEMENTS} and {@link #MAX_STATEMENTS} statements, one per line, each terminated
	 */
	private String generateProgram(Expansion expansion, String statement){
		int count = MIN_STATEMENTS + values.nextInt(MAX_STATEMENTS - MIN_STATEMENTS + 1);
		List<String> statements = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			String stmt = expansion.expand(Symbol.nonTerminal(statement), 0).trim();
			statements.add(stmt.endsWith(STATEMENT_TERMINATOR) ? stmt : stmt + STATEMENT_TERMINATOR);
		}
		return String.join("\n", statements);
	}

	/**
	 * The defined non terminal that matches the start name, the first defined non terminal or a symbol named "start".
	 * A declared start that has no productions is skipped.
	 */
	private Symbol resolveStart(Grammar grammar, String startName){
		if (startName != null){
			for (Symbol symbol : grammar.getDefinedNonTerminals()) {
				if (symbol.name.equalsIgnoreCase(startName)){
					return symbol;
				}
			}
		}
		if (!grammar.getDefinedNonTerminals().isEmpty()){
			return grammar.getDefinedNonTerminals().iterator().next();
		}
		return Symbol.nonTerminal(DEFAULT_START);
	}

	/**
	 * A single generation run over a grammar
	 */
	private class Expansion {

		private final Grammar grammar;
		private final int maxDepth;

		Expansion(Grammar grammar, int maxDepth) {
			this.grammar = grammar;
			this.maxDepth = maxDepth;
		}

		String expand(Symbol symbol, int depth){
			if (symbol.isEpsilon()){
				return "";
			}
			String name = symbol.name;
			if (SymbolClassifier.isQuotedLiteral(name)){
				return SymbolClassifier.unquote(name);
			}
			if (SymbolClassifier.isPatternLiteral(name)){
				return values.string();
			}
			String kindSample = policy.sampleTerminalKind(name, values);
			if (kindSample != null){
				return kindSample;
			}
			if (policy.isAtom(name)){
				return policy.expandAtom((n, d) -> expand(Symbol.nonTerminal(n), d), depth, values);
			}
			List<Production> alternatives = grammar.getProductionsOf(name);
			if (alternatives.isEmpty()){
				if (symbol.isTerminal()){
					return name;
				}
				return fallback(name, "it has no productions");
			}
			if (depth > maxDepth){
				if (policy.isTail(name)){
					return "";
				}
				return fallback(name, "the maximum depth " + maxDepth + " is reached");
			}
			Production chosen = pickAlternative(alternatives, depth);
			List<String> parts = new ArrayList<>();
			for (Symbol sym : chosen.right) {
				parts.add(expand(sym, depth + 1));
			}
			String out = OutputNormalizer.normalize(String.join(" ", parts));
			return out.isEmpty() ? policy.minimalSample(name, values) : out;
		}

		private String fallback(String name, String reason){
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest(String.format("Using a minimal sample for %s, %s", name, reason));
			}
			return policy.minimalSample(name, values);
		}

		/**
		 * Prefers non epsilon alternatives, beyond the {@link #SHRINK_DEPTH} also alternatives that don't start
		 * with the non terminal itself and the shorter half of the alternatives.
		 */
		private Production pickAlternative(List<Production> alternatives, int depth){
			List<Production> pool = alternatives.stream().filter(p -> !p.isEpsilonProduction()).collect(Collectors.toList());
			if (pool.isEmpty()){
				pool = alternatives;
			}
			if (depth > SHRINK_DEPTH){
				List<Production> safe = pool.stream().filter(p -> !p.isDirectlyLeftRecursive()).collect(Collectors.toList());
				if (!safe.isEmpty()){
					pool = safe;
				}
			}
			List<Production> sorted = new ArrayList<>(pool);
			sorted.sort(Comparator.comparingInt(Production::rightSize));
			if (depth > SHRINK_DEPTH){
				return sorted.get(values.nextInt((sorted.size() + 1) / 2));
			}
			return values.pick(sorted);
		}
	}
}
