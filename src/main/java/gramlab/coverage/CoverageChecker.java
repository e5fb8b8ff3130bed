package gramlab.coverage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import gramlab.lexer.LineClassifier;

/**
 * Checks which lines of a source text only use tokens that a grammar knows.
 *
 * The known tokens are the contents of the quoted literals of the grammar, identifiers, numbers
 * and string literals are always accepted.
 */
public class CoverageChecker {

	private static final Pattern QUOTED_LITERAL = Pattern.compile("'((?:[^'\\\\]|\\\\.)+)'");

	private static final String STRING = "\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'";
	private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
	private static final String NUMBER = "(?:0|[1-9][0-9]*)";
	private static final String OPERATOR = "==|!=|<=|>=|&&|\\|\\||\\+=|-=|\\*=|/=|%=|\\+\\+|--|->|::|<<|>>|<|>|=|\\+|-|\\*|/|%|\\^|&|\\||~|!";
	private static final String PUNCTUATION = "[(){}\\[\\];,.:?]";

	private static final Pattern TOKEN = Pattern.compile(
			String.join("|", STRING, IDENTIFIER, NUMBER, OPERATOR, PUNCTUATION));

	private static final Pattern STRING_PATTERN = Pattern.compile(STRING);
	private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER);
	private static final Pattern NUMBER_PATTERN = Pattern.compile(NUMBER);

	/**
	 * Contents of all quoted literals in the grammar text
	 */
	public static Set<String> quotedTerminals(String grammarText){
		Set<String> terminals = new LinkedHashSet<>();
		Matcher matcher = QUOTED_LITERAL.matcher(grammarText);
		while (matcher.find()){
			terminals.add(matcher.group(1));
		}
		return terminals;
	}

	/**
	 * Tokens of a single source line, characters that aren't part of a token are skipped
	 */
	public static List<String> tokens(String line){
		List<String> tokens = new ArrayList<>();
		Matcher matcher = TOKEN.matcher(line);
		while (matcher.find()){
			tokens.add(matcher.group());
		}
		return tokens;
	}

	public static CoverageReport check(String grammarText, String sourceText){
		Set<String> allowed = quotedTerminals(grammarText);
		List<String> lines = sourceText.isEmpty() ? new ArrayList<>() : LineClassifier.lines(sourceText);
		List<CoverageReport.UncoveredLine> uncovered = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.trim().isEmpty()){
				continue;
			}
			for (String token : tokens(line)) {
				if (!isCovered(token, allowed)){
					uncovered.add(new CoverageReport.UncoveredLine(i, line, token));
					break;
				}
			}
		}
		return new CoverageReport(lines.size(), uncovered);
	}

	private static boolean isCovered(String token, Set<String> allowed){
		return IDENTIFIER_PATTERN.matcher(token).matches()
				|| NUMBER_PATTERN.matcher(token).matches()
				|| STRING_PATTERN.matcher(token).matches()
				|| allowed.contains(token);
	}
}
