package gramlab.diagnostics;

import java.util.Objects;

import gramlab.lexer.Range;

/**
 * A located problem in a grammar text.
 */
public class Diagnostic {

	private final Severity severity;
	private final String message;
	private final Range range;

	public Diagnostic(Severity severity, String message, Range range) {
		this.severity = severity;
		this.message = message;
		this.range = range;
	}

	public static Diagnostic error(String message, Range range){
		return new Diagnostic(Severity.ERROR, message, range);
	}

	public static Diagnostic warning(String message, Range range){
		return new Diagnostic(Severity.WARNING, message, range);
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getMessage() {
		return message;
	}

	public Range getRange() {
		return range;
	}

	public boolean isError(){
		return severity == Severity.ERROR;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Diagnostic)){
			return false;
		}
		Diagnostic other = (Diagnostic)obj;
		return severity == other.severity && message.equals(other.message) && range.equals(other.range);
	}

	@Override
	public int hashCode() {
		return Objects.hash(severity, message, range);
	}

	@Override
	public String toString() {
		return String.format("[%s|%s] %s", severity, range, message);
	}
}
