package works.strata.exceptions;

public final class ArbitraryGenerationException extends StrataException {
	public ArbitraryGenerationException(String message) {
		super(message);
	}
}
