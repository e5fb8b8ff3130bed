package gramlab;

/**
 * Base exception for errors at the boundary of the project (command line, configuration, file access).
 *
 * The analysis core itself never throws, malformed grammar input degrades to smaller results.
 */
public class GramLabException extends RuntimeException {

	public GramLabException(String message) {
		super(message);
	}

	public GramLabException(String message, Throwable cause) {
		super(message, cause);
	}
}
