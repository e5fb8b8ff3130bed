package gramlab.grammar.random;

import java.util.regex.Pattern;

/**
 * Normalizes the spacing of generated sentences and removes parentheses around single atoms.
 */
public class OutputNormalizer {

	private static final Pattern SPACE_BEFORE_CLOSING = Pattern.compile("\\s+([;:),\\]}])");
	private static final Pattern SPACE_AFTER_OPENING = Pattern.compile("([(\\[{])\\s+");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final Pattern PARENTHESIZED_IDENTIFIER = Pattern.compile("\\(\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\)");
	private static final Pattern PARENTHESIZED_NUMBER = Pattern.compile("\\(\\s*(\\d+)\\s*\\)");
	private static final Pattern PARENTHESIZED_STRING = Pattern.compile("\\(\\s*\"([^\"]*)\"\\s*\\)");

	/**
	 * A bare identifier, number or double quoted string
	 */
	private static final Pattern ATOM = Pattern.compile("(?:[A-Za-z_][A-Za-z0-9_]*|\\d+|\".*\")");

	public static String normalize(String sentence){
		String out = SPACE_BEFORE_CLOSING.matcher(sentence).replaceAll("$1");
		out = SPACE_AFTER_OPENING.matcher(out).replaceAll("$1");
		out = WHITESPACE.matcher(out).replaceAll(" ").trim();
		out = PARENTHESIZED_IDENTIFIER.matcher(out).replaceAll("$1");
		out = PARENTHESIZED_NUMBER.matcher(out).replaceAll("$1");
		return PARENTHESIZED_STRING.matcher(out).replaceAll("\"$1\"");
	}

	/**
	 * Is the passed string a single identifier, number or string without inner structure?
	 */
	public static boolean isAtom(String str){
		return ATOM.matcher(str).matches();
	}
}
