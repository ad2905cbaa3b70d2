package works.strata.types;

import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

/**
 * Bounds are checked by the validator, not the decoder.
 * <p>
 * When both an inclusive and an exclusive bound are given on the same side,
 * the tighter one takes effect.
 */
@With
@Builder(toBuilder = true)
public record NumberOptions(
	@Nullable String name,
	@Nullable String description,
	boolean sensitive,
	boolean isInteger,
	@Nullable Double minimum,
	@Nullable Double exclusiveMinimum,
	@Nullable Double maximum,
	@Nullable Double exclusiveMaximum
) implements TypeOptions {
	public static final NumberOptions NONE = new NumberOptions(null, null, false, false, null, null, null, null);
	public static final NumberOptions INTEGER = new NumberOptions(null, null, false, true, null, null, null, null);

	public NumberOptions {
		checkFinite("minimum", minimum);
		checkFinite("exclusiveMinimum", exclusiveMinimum);
		checkFinite("maximum", maximum);
		checkFinite("exclusiveMaximum", exclusiveMaximum);
		Double lower = tighter(minimum, exclusiveMinimum, true);
		Double upper = tighter(maximum, exclusiveMaximum, false);
		if (lower != null && upper != null) {
			boolean exclusive = lower.equals(exclusiveMinimum) || upper.equals(exclusiveMaximum);
			if (exclusive && lower.equals(upper)) {
				throw new InvalidTypeException("Lower bound (" + lower + ") cannot be equal to an exclusive upper bound (" + upper + ")");
			}
			if (lower > upper) {
				throw new InvalidTypeException("Lower bound (" + lower + ") must be less than or equal to upper bound (" + upper + ")");
			}
		}
		if (isInteger) {
			for (Double bound: new Double[]{ minimum, exclusiveMinimum, maximum, exclusiveMaximum }) {
				if (bound != null && bound != Math.rint(bound)) {
					throw new InvalidTypeException("Bounds of integer types must be integers: " + bound);
				}
			}
			if (exclusiveMinimum != null && exclusiveMaximum != null && exclusiveMaximum - exclusiveMinimum <= 1) {
				throw new InvalidTypeException("Exclusive bounds of an integer type (" + exclusiveMinimum + ", " + exclusiveMaximum + ") admit no values");
			}
		}
	}

	private static void checkFinite(String which, Double bound) {
		if (bound != null && !Double.isFinite(bound)) {
			throw new InvalidTypeException("Number " + which + " must be finite: " + bound);
		}
	}

	private static Double tighter(Double inclusive, Double exclusive, boolean isLower) {
		if (inclusive == null) {
			return exclusive;
		} else if (exclusive == null) {
			return inclusive;
		} else if (isLower) {
			return exclusive >= inclusive ? exclusive : inclusive;
		} else {
			return exclusive <= inclusive ? exclusive : inclusive;
		}
	}
}
