package gramlab.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Second stage of the grammar tokenizer: splits the right hand side of a rule into alternatives
 * and the alternatives into symbol tokens.
 *
 * Quoted literals (<code>'...'</code>) and pattern literals (<code>/.../</code>) are opaque spans:
 * neither <code>|</code> nor whitespace inside them splits anything. A span only opens if its closing
 * delimiter exists later on the line, a backslash escapes the next character inside a span. Quoted
 * literals are tokens of their own even without surrounding whitespace, <code>'('E')'</code> has three
 * tokens. A pattern only opens at the start of a token and never before whitespace, so
 * <code>a / b / c</code> contains three terminals and two division operators.
 */
public class RhsSplitter {

	public static final char ALTERNATIVE_SEPARATOR = '|';
	public static final char QUOTE = '\'';
	public static final char SLASH = '/';

	/**
	 * Split the right hand side at its top level <code>|</code> characters.
	 *
	 * Alternatives are trimmed, empty alternatives (like in <code>a | | b</code> or <code>a |</code>) are kept as
	 * empty strings.
	 */
	public static List<String> splitAlternatives(String rhs){
		List<String> alternatives = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int i = 0;
		while (i < rhs.length()){
			char c = rhs.charAt(i);
			int spanEnd = spanEnd(rhs, i);
			if (spanEnd != -1){
				current.append(rhs, i, spanEnd + 1);
				i = spanEnd + 1;
				continue;
			}
			if (c == ALTERNATIVE_SEPARATOR){
				alternatives.add(current.toString().trim());
				current.setLength(0);
			} else {
				current.append(c);
			}
			i++;
		}
		alternatives.add(current.toString().trim());
		return alternatives;
	}

	/**
	 * Split an alternative into its tokens at whitespace outside of literal spans.
	 */
	public static List<String> tokenize(String alternative){
		List<String> tokens = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int i = 0;
		while (i < alternative.length()){
			char c = alternative.charAt(i);
			int spanEnd = spanEnd(alternative, i);
			if (spanEnd != -1){
				flush(current, tokens);
				current.append(alternative, i, spanEnd + 1);
				flush(current, tokens);
				i = spanEnd + 1;
				continue;
			}
			if (Character.isWhitespace(c)){
				flush(current, tokens);
			} else {
				current.append(c);
			}
			i++;
		}
		flush(current, tokens);
		return tokens;
	}

	/**
	 * Tokens of all alternatives of the passed right hand side
	 */
	public static List<List<String>> split(String rhs){
		List<List<String>> ret = new ArrayList<>();
		for (String alternative : splitAlternatives(rhs)){
			ret.add(tokenize(alternative));
		}
		return ret;
	}

	private static void flush(StringBuilder current, List<String> tokens){
		if (current.length() > 0){
			tokens.add(current.toString());
			current.setLength(0);
		}
	}

	/**
	 * Index of the closing delimiter of a literal span that opens at <code>start</code>.
	 *
	 * @return -1 if no span opens at this position
	 */
	static int spanEnd(String str, int start){
		char open = str.charAt(start);
		if (open != QUOTE && open != SLASH){
			return -1;
		}
		if (open == SLASH){
			if (start > 0 && !Character.isWhitespace(str.charAt(start - 1)) && str.charAt(start - 1) != ALTERNATIVE_SEPARATOR){
				return -1;
			}
			if (start + 1 >= str.length() || Character.isWhitespace(str.charAt(start + 1))){
				return -1;
			}
		}
		for (int i = start + 1; i < str.length(); i++){
			char c = str.charAt(i);
			if (c == '\\'){
				i++;
			} else if (c == open){
				return i;
			}
		}
		return -1;
	}
}
