package works.strata.options;

public enum TypeCastingStrategy {
	/**
	 * Only the native representation of each kind is accepted.
	 */
	EXPECT_EXACT_TYPES,

	/**
	 * Convertible representations are also accepted,
	 * like {@code "42"} for a number or {@code "true"} for a boolean.
	 */
	TRY_CASTING,
}
