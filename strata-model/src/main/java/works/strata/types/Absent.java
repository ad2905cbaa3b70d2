package works.strata.types;

/**
 * Represents a raw input value that isn't there at all,
 * as distinct from one that is present and null.
 * <p>
 * This only appears in raw input and in the intermediate results of decoding.
 * In typed values, an absent field is simply a missing map key,
 * and an absent optional anywhere else becomes null.
 */
public enum Absent {
	VALUE;

	@Override
	public String toString() {
		return "undefined";
	}
}
