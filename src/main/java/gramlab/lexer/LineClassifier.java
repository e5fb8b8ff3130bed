package gramlab.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * First stage of the grammar tokenizer: classifies single lines of a grammar text.
 *
 * Two line shapes carry meaning:
 * <pre>
 *   start : IDENT ;?            (start declaration, the rest of the line is ignored)
 *   IDENT (-> | →) RHS          (rule, RHS isn't empty)
 * </pre>
 * Blank lines and lines starting with <code>//</code> or <code>#</code> are skipped,
 * everything else is {@link Type#UNKNOWN}.
 */
public class LineClassifier {

	public static final String START_KEYWORD = "start";
	public static final String ARROW = "->";
	public static final String UNICODE_ARROW = "→";

	public enum Type {
		BLANK,
		COMMENT,
		START,
		RULE,
		UNKNOWN
	}

	/**
	 * A classified line
	 */
	public static class GrammarLine {

		public final Type type;

		/**
		 * 0-based line number
		 */
		public final int lineNumber;

		/**
		 * Declared start symbol for START lines, left hand side for RULE lines, null otherwise
		 */
		public final String name;

		/**
		 * Right hand side text of a RULE line, null otherwise
		 */
		public final String rhs;

		GrammarLine(Type type, int lineNumber, String name, String rhs) {
			this.type = type;
			this.lineNumber = lineNumber;
			this.name = name;
			this.rhs = rhs;
		}

		@Override
		public String toString() {
			switch (type){
				case START:
					return lineNumber + " start: " + name;
				case RULE:
					return lineNumber + " " + name + " -> " + rhs;
				default:
					return lineNumber + " " + type.name().toLowerCase();
			}
		}
	}

	/**
	 * Split the passed text into lines (<code>\n</code> or <code>\r\n</code>)
	 */
	public static List<String> lines(String text){
		List<String> lines = new ArrayList<>();
		if (text == null){
			return lines;
		}
		for (String line : text.split("\r?\n", -1)){
			lines.add(line);
		}
		return lines;
	}

	/**
	 * Classify all lines of the passed text
	 */
	public static List<GrammarLine> classifyAll(String text){
		List<GrammarLine> ret = new ArrayList<>();
		List<String> lines = lines(text);
		for (int i = 0; i < lines.size(); i++){
			ret.add(classify(lines.get(i), i));
		}
		return ret;
	}

	public static GrammarLine classify(String rawLine, int lineNumber){
		String line = rawLine.trim();
		if (line.isEmpty()){
			return new GrammarLine(Type.BLANK, lineNumber, null, null);
		}
		if (line.startsWith("//") || line.startsWith("#")){
			return new GrammarLine(Type.COMMENT, lineNumber, null, null);
		}
		String start = matchStart(line);
		if (start != null){
			return new GrammarLine(Type.START, lineNumber, start, null);
		}
		int identEnd = identifierEnd(line, 0);
		if (identEnd > 0){
			int pos = skipWhitespace(line, identEnd);
			int arrowEnd = -1;
			if (line.startsWith(ARROW, pos)){
				arrowEnd = pos + ARROW.length();
			} else if (line.startsWith(UNICODE_ARROW, pos)){
				arrowEnd = pos + UNICODE_ARROW.length();
			}
			if (arrowEnd != -1){
				String rhs = line.substring(skipWhitespace(line, arrowEnd));
				if (!rhs.isEmpty()){
					return new GrammarLine(Type.RULE, lineNumber, line.substring(0, identEnd), rhs);
				}
			}
		}
		return new GrammarLine(Type.UNKNOWN, lineNumber, null, null);
	}

	/**
	 * @return declared start symbol or null if the line isn't a start declaration
	 */
	private static String matchStart(String line){
		if (!line.startsWith(START_KEYWORD)){
			return null;
		}
		int pos = skipWhitespace(line, START_KEYWORD.length());
		if (pos >= line.length() || line.charAt(pos) != ':'){
			return null;
		}
		pos = skipWhitespace(line, pos + 1);
		int end = identifierEnd(line, pos);
		if (end <= pos){
			return null;
		}
		return line.substring(pos, end);
	}

	/**
	 * Matches <code>[A-Za-z_][A-Za-z0-9_]*</code> starting at <code>from</code>.
	 *
	 * @return end index of the identifier, <code>from</code> if there is none
	 */
	static int identifierEnd(String str, int from){
		if (from >= str.length() || !isIdentifierStart(str.charAt(from))){
			return from;
		}
		int pos = from + 1;
		while (pos < str.length() && isIdentifierPart(str.charAt(pos))){
			pos++;
		}
		return pos;
	}

	static boolean isIdentifierStart(char c){
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	static boolean isIdentifierPart(char c){
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}

	private static int skipWhitespace(String str, int from){
		int pos = from;
		while (pos < str.length() && Character.isWhitespace(str.charAt(pos))){
			pos++;
		}
		return pos;
	}
}
