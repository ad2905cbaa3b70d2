package works.strata.types;

/**
 * Whether decoded collections may be modified by their recipient.
 */
public enum Mutability {
	IMMUTABLE,
	MUTABLE,
}
