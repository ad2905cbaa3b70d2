package works.strata.custom;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

/**
 * @param decimals the number of digits after the decimal point;
 *                 when decoding with casting, inputs are rounded to this many
 */
@With
@Builder(toBuilder = true)
public record DecimalOptions(
	@Nullable Integer decimals,
	@Nullable BigDecimal minimum,
	@Nullable BigDecimal exclusiveMinimum,
	@Nullable BigDecimal maximum,
	@Nullable BigDecimal exclusiveMaximum,
	@Nullable BigDecimal multipleOf
) {
	public static final DecimalOptions NONE = new DecimalOptions(null, null, null, null, null, null);

	public DecimalOptions {
		if (decimals != null && (decimals < 0 || decimals > 100)) {
			throw new InvalidTypeException("Decimals must be between 0 and 100: " + decimals);
		}
		if (multipleOf != null && multipleOf.signum() <= 0) {
			throw new InvalidTypeException("multipleOf must be positive: " + multipleOf);
		}
		BigDecimal lower = minimum != null ? minimum : exclusiveMinimum;
		BigDecimal upper = maximum != null ? maximum : exclusiveMaximum;
		if (lower != null && upper != null && lower.compareTo(upper) > 0) {
			throw new InvalidTypeException("Lower bound " + lower + " exceeds upper bound " + upper);
		}
	}
}
