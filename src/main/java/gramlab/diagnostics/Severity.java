package gramlab.diagnostics;

public enum Severity {
	ERROR,
	WARNING;

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
