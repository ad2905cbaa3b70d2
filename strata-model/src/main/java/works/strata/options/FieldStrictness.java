package works.strata.options;

/**
 * What to do with input keys that match no declared field of an object.
 */
public enum FieldStrictness {
	EXPECT_EXACT_FIELDS,

	/**
	 * Undeclared keys are dropped from the decoded value.
	 */
	ALLOW_ADDITIONAL_FIELDS,
}
