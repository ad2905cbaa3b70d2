package works.strata.retrieve;

/**
 * Explains why no retrieve shape could be derived for a type.
 */
public record RetrieveError(Reason reason, String message) {
	public enum Reason {
		NOT_AN_ENTITY,
		NO_CAPABILITIES,
		UNSUPPORTED_SHAPE,
	}

	@Override
	public String toString() {
		return reason + ": " + message;
	}
}
