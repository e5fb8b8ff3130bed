package gramlab.lexer;

import java.util.Objects;

/**
 * Position in a grammar text, line and column both start at zero.
 */
public class Location implements Comparable<Location> {

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Location)){
			return false;
		}
		Location other = (Location)obj;
		return line == other.line && column == other.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, column);
	}

	@Override
	public int compareTo(Location o) {
		if (line != o.line){
			return Integer.compare(line, o.line);
		}
		return Integer.compare(column, o.column);
	}
}
