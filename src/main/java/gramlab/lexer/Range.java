package gramlab.lexer;

import java.util.Objects;

/**
 * Source range between two locations, the end column is exclusive.
 */
public class Range {

	public final Location start;
	public final Location end;

	public Range(Location start, Location end) {
		this.start = start;
		this.end = end;
	}

	public Range(int startLine, int startColumn, int endLine, int endColumn) {
		this(new Location(startLine, startColumn), new Location(endLine, endColumn));
	}

	/**
	 * Range on a single line.
	 */
	public static Range onLine(int line, int startColumn, int endColumn){
		return new Range(line, startColumn, line, endColumn);
	}

	public int getStartLine() {
		return start.line;
	}

	public int getStartColumn() {
		return start.column;
	}

	public int getEndLine() {
		return end.line;
	}

	public int getEndColumn() {
		return end.column;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Range)){
			return false;
		}
		Range other = (Range)obj;
		return start.equals(other.start) && end.equals(other.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return start.line + ":" + start.column + "-" + end.line + ":" + end.column;
	}
}
