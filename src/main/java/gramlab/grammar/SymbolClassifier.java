package gramlab.grammar;

/**
 * Classifies grammar tokens by their lexical shape.
 *
 * Quoted literals (<code>'...'</code>) and pattern literals (<code>/.../</code>) are terminals regardless of case,
 * <code>ε</code> and <code>epsilon</code> (any case) mark the empty word, tokens starting with an ASCII
 * uppercase letter are non terminals and everything else is a terminal.
 */
public final class SymbolClassifier {

	private SymbolClassifier(){
	}

	public static SymbolKind classify(String token){
		if (isQuotedLiteral(token) || isPatternLiteral(token)){
			return SymbolKind.TERMINAL;
		}
		if (isEpsilon(token)){
			return SymbolKind.EPSILON;
		}
		if (startsUppercase(token)){
			return SymbolKind.NONTERMINAL;
		}
		return SymbolKind.TERMINAL;
	}

	public static boolean isNonTerminal(String token){
		return classify(token) == SymbolKind.NONTERMINAL;
	}

	public static boolean isTerminal(String token){
		return classify(token) == SymbolKind.TERMINAL;
	}

	public static boolean isEpsilon(String token){
		return Symbol.EPSILON_MARKER.equals(token) || "epsilon".equalsIgnoreCase(token);
	}

	public static boolean isQuotedLiteral(String token){
		return isDelimited(token, '\'');
	}

	public static boolean isPatternLiteral(String token){
		return isDelimited(token, '/');
	}

	/**
	 * Contents of a quoted or pattern literal without the delimiters, the token itself otherwise.
	 */
	public static String unquote(String token){
		if (isQuotedLiteral(token) || isPatternLiteral(token)){
			return token.substring(1, token.length() - 1);
		}
		return token;
	}

	private static boolean startsUppercase(String token){
		return !token.isEmpty() && token.charAt(0) >= 'A' && token.charAt(0) <= 'Z';
	}

	private static boolean isDelimited(String token, char delimiter){
		return token.length() >= 2 && token.charAt(0) == delimiter && token.charAt(token.length() - 1) == delimiter;
	}
}
