package works.strata.exceptions;

/**
 * The type graph is inconsistent with a value that was supposed to conform to it,
 * or a lazy type could not be resolved.
 */
public final class TypeGraphException extends StrataException {
	public TypeGraphException(String message) {
		super(message);
	}

	public TypeGraphException(String message, Throwable cause) {
		super(message, cause);
	}
}
