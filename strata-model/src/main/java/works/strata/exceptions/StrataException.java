package works.strata.exceptions;

/**
 * Signals a programmer error: a malformed type graph, or a broken internal invariant.
 * <p>
 * Problems with <em>input values</em> are never reported this way;
 * they are returned as errors inside a {@link works.strata.result.Result}.
 */
public sealed abstract class StrataException extends RuntimeException
	permits InvalidTypeException, TypeGraphException, ArbitraryGenerationException {

	protected StrataException(String message) {
		super(message);
	}

	protected StrataException(String message, Throwable cause) {
		super(message, cause);
	}
}
