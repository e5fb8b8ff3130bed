package gramlab.grammar.random;

/**
 * Symbol name conventions that steer the {@link SentenceGenerator}.
 *
 * This base policy knows no conventions: no terminal kinds, no atomic expressions, no tail
 * non terminals and no statement lists, every dead end becomes an identifier. Grammars then
 * only get the generic shortest-alternative behaviour of the generator.
 *
 * @see ExpressionGrammarPolicy
 */
public class GenerationPolicy {

	/**
	 * Policy without name conventions
	 */
	public static GenerationPolicy generic(){
		return new GenerationPolicy();
	}

	/**
	 * Policy for expression and statement grammars (<code>Expr</code>, <code>Factor</code>, <code>Stmt</code>, ...)
	 */
	public static GenerationPolicy conventional(){
		return new ExpressionGrammarPolicy();
	}

	/**
	 * Sample value for symbols that stand for a kind of terminal (like identifiers)
	 *
	 * @return null if the symbol isn't such a kind
	 */
	public String sampleTerminalKind(String name, SampleValues values){
		return null;
	}

	/**
	 * Is the symbol the leaf expression rule that is expanded by {@link #expandAtom(Expander, int, SampleValues)}?
	 */
	public boolean isAtom(String name){
		return false;
	}

	/**
	 * Expand the leaf expression rule
	 *
	 * @param expander expands other symbols
	 * @param depth current depth
	 */
	public String expandAtom(Expander expander, int depth, SampleValues values){
		return values.identifier();
	}

	/**
	 * Is the symbol a right recursive continuation that should become empty when the depth bound is reached?
	 */
	public boolean isTail(String name){
		return false;
	}

	/**
	 * Replacement for a non terminal that has no productions or can't be expanded further.
	 */
	public String minimalSample(String name, SampleValues values){
		return values.identifier();
	}

	/**
	 * @return name of the statement non terminal or null
	 */
	public String statementName(){
		return null;
	}

	/**
	 * @return name of the statement list non terminal or null
	 */
	public String statementListName(){
		return null;
	}

	/**
	 * Expands a non terminal by name, at the passed depth
	 */
	@FunctionalInterface
	public interface Expander {
		String expand(String name, int depth);
	}
}
