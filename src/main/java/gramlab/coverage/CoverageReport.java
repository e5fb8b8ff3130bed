package gramlab.coverage;

import java.util.Collections;
import java.util.List;

/**
 * Result of a {@link CoverageChecker} run.
 */
public class CoverageReport {

	/**
	 * A source line that contains a token the grammar doesn't know
	 */
	public static class UncoveredLine {

		/**
		 * 0-based line number
		 */
		public final int line;
		public final String text;
		/**
		 * First token of the line that isn't covered
		 */
		public final String token;

		public UncoveredLine(int line, String text, String token) {
			this.line = line;
			this.text = text;
			this.token = token;
		}

		@Override
		public String toString() {
			return String.format("%d: unknown token '%s' in %s", line, token, text.trim());
		}
	}

	private final int totalLines;
	private final List<UncoveredLine> uncoveredLines;

	CoverageReport(int totalLines, List<UncoveredLine> uncoveredLines) {
		this.totalLines = totalLines;
		this.uncoveredLines = Collections.unmodifiableList(uncoveredLines);
	}

	public int getTotalLines() {
		return totalLines;
	}

	public int getCoveredLines(){
		return totalLines - uncoveredLines.size();
	}

	public List<UncoveredLine> getUncoveredLines() {
		return uncoveredLines;
	}

	/**
	 * Rounded percentage of covered lines, 100 for an empty source
	 */
	public int getCoveragePercent(){
		if (totalLines == 0){
			return 100;
		}
		return (int)Math.round(getCoveredLines() * 100.0 / totalLines);
	}

	@Override
	public String toString() {
		return String.format("Grammar coverage: %d%% • uncovered lines: %d/%d", getCoveragePercent(),
				uncoveredLines.size(), totalLines);
	}
}
