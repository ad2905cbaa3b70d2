package works.strata.exceptions;

/**
 * A type was constructed with options that can't be satisfied,
 * like a string whose minimum length exceeds its maximum.
 */
public final class InvalidTypeException extends StrataException {
	public InvalidTypeException(String message) {
		super(message);
	}
}
