package gramlab.grammar.random;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import gramlab.util.Pair;

import static gramlab.util.Pair.p;

/**
 * Conventions of typical expression and statement grammars:
 * <ul>
 *     <li><code>ID</code>, <code>NUM</code> and <code>STR</code> are terminal kinds</li>
 *     <li><code>Factor</code> is the leaf of the expression rules, it becomes an identifier, a number,
 *     a string or a parenthesized <code>Expr</code> (weighted 40/30/15/15)</li>
 *     <li>non terminals ending with <code>Tail</code> are right recursive continuations</li>
 *     <li><code>Stmt</code> and <code>StmtList</code> describe a program of statements</li>
 * </ul>
 */
public class ExpressionGrammarPolicy extends GenerationPolicy {

	public static final String IDENTIFIER_KIND = "ID";
	public static final String NUMBER_KIND = "NUM";
	public static final String STRING_KIND = "STR";
	public static final String ATOM = "Factor";
	public static final String EXPRESSION = "Expr";
	public static final String TAIL_SUFFIX = "Tail";
	public static final String STATEMENT = "Stmt";
	public static final String STATEMENT_LIST = "StmtList";

	/**
	 * Non terminals whose minimal sample is a number
	 */
	private static final Set<String> NUMBER_SHAPED = Collections.unmodifiableSet(
			new HashSet<>(Arrays.asList(EXPRESSION, "AddExpr", ATOM)));

	private enum AtomChoice {
		IDENTIFIER, NUMBER, STRING, PARENTHESIZED
	}

	private static final List<Pair<AtomChoice, Integer>> ATOM_WEIGHTS = Arrays.asList(
			p(AtomChoice.IDENTIFIER, 40),
			p(AtomChoice.NUMBER, 30),
			p(AtomChoice.STRING, 15),
			p(AtomChoice.PARENTHESIZED, 15));

	@Override
	public String sampleTerminalKind(String name, SampleValues values) {
		switch (name){
			case IDENTIFIER_KIND:
				return values.identifier();
			case NUMBER_KIND:
				return values.number();
			case STRING_KIND:
				return values.string();
			default:
				return null;
		}
	}

	@Override
	public boolean isAtom(String name) {
		return ATOM.equals(name);
	}

	/**
	 * Parentheses are only kept if the inner expression has some structure, <code>(x1)</code> becomes
	 * an identifier or a number.
	 */
	@Override
	public String expandAtom(Expander expander, int depth, SampleValues values) {
		switch (values.pickWeighted(ATOM_WEIGHTS)){
			case IDENTIFIER:
				return values.identifier();
			case NUMBER:
				return values.number();
			case STRING:
				return values.string();
			default:
				String inner = expander.expand(EXPRESSION, depth + 1);
				if (OutputNormalizer.isAtom(inner)){
					return values.chance(0.5) ? values.identifier() : values.number();
				}
				return "(" + inner + ")";
		}
	}

	@Override
	public boolean isTail(String name) {
		return name.endsWith(TAIL_SUFFIX);
	}

	@Override
	public String minimalSample(String name, SampleValues values) {
		if (isTail(name)){
			return "";
		}
		if (NUMBER_SHAPED.contains(name)){
			return values.number();
		}
		if (STATEMENT.equals(name)){
			return values.identifier() + " = " + values.number();
		}
		return values.identifier();
	}

	@Override
	public String statementName() {
		return STATEMENT;
	}

	@Override
	public String statementListName() {
		return STATEMENT_LIST;
	}
}
