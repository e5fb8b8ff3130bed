package gramlab.diagnostics;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * List of diagnostics
 */
public class DiagnosticPipe extends AbstractList<Diagnostic> {
	private final List<Diagnostic> diagnostics;

	DiagnosticPipe() {
		diagnostics = new ArrayList<>();
	}

	@Override
	public Diagnostic get(int index) {
		return diagnostics.get(index);
	}

	@Override
	public int size() {
		return diagnostics.size();
	}

	@Override
	public boolean add(Diagnostic diagnostic) {
		return diagnostics.add(diagnostic);
	}

	public boolean hasErrors(){
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public List<Diagnostic> ofSeverity(Severity severity){
		return diagnostics.stream().filter(d -> d.getSeverity() == severity).collect(Collectors.toList());
	}

	/**
	 * Number of diagnostics per severity, like <code>error: 2, warning: 1</code>
	 */
	@Override
	public String toString() {
		return diagnostics.stream().collect(Collectors.groupingBy(Diagnostic::getSeverity, Collectors.counting()))
				.entrySet().stream().sorted(Map.Entry.comparingByKey())
				.map(e -> String.format("%s: %d", e.getKey(), e.getValue())).collect(Collectors.joining(", "));
	}

	public String toLongString(){
		return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
	}
}
