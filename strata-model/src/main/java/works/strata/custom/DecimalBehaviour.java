package works.strata.custom;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;

/**
 * Accepts strings and numbers; encodes as a plain decimal string.
 * <p>
 * With a fixed number of {@link DecimalOptions#decimals() decimals}, exact decoding rejects
 * inputs with more digits, while casting rounds them half-up.
 */
final class DecimalBehaviour implements CustomBehaviour<DecimalOptions> {
	static final DecimalBehaviour INSTANCE = new DecimalBehaviour();

	static final int DEFAULT_GENERATED_DECIMALS = 2;
	static final BigDecimal DEFAULT_GENERATED_RANGE = BigDecimal.valueOf(1_000_000);
	static final int GENERATION_ATTEMPTS = 1000;

	private DecimalBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, DecimalOptions customOptions) {
		BigDecimal decoded;
		if (raw instanceof BigDecimal d) {
			decoded = d;
		} else if (raw instanceof String || raw instanceof Long || raw instanceof Integer) {
			try {
				decoded = new BigDecimal(raw.toString().trim());
			} catch (NumberFormatException e) {
				return Result.failure(DecodingError.of("decimal", raw));
			}
		} else if (raw instanceof Number n && Double.isFinite(n.doubleValue())) {
			decoded = BigDecimal.valueOf(n.doubleValue());
		} else {
			return Result.failure(DecodingError.of("decimal", raw));
		}

		Integer decimals = customOptions.decimals();
		if (decimals != null && decoded.scale() != decimals) {
			BigDecimal rounded = decoded.setScale(decimals, RoundingMode.HALF_UP);
			if (!options.tryCasting() && rounded.compareTo(decoded) != 0) {
				return Result.failure(DecodingError.of("decimal with at most " + decimals + " decimal places", raw));
			}
			decoded = rounded;
		}
		return Result.ok(decoded);
	}

	@Override
	public Object encode(Object value, EncodingOptions options, DecimalOptions customOptions) {
		return ((BigDecimal) value).toPlainString();
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, DecimalOptions customOptions) {
		BigDecimal d = (BigDecimal) value;
		if (customOptions.maximum() != null && d.compareTo(customOptions.maximum()) > 0) {
			return fail("decimal must be less than or equal to " + customOptions.maximum(), value);
		}
		if (customOptions.minimum() != null && d.compareTo(customOptions.minimum()) < 0) {
			return fail("decimal must be greater than or equal to " + customOptions.minimum(), value);
		}
		if (customOptions.exclusiveMaximum() != null && d.compareTo(customOptions.exclusiveMaximum()) >= 0) {
			return fail("decimal must be less than " + customOptions.exclusiveMaximum(), value);
		}
		if (customOptions.exclusiveMinimum() != null && d.compareTo(customOptions.exclusiveMinimum()) <= 0) {
			return fail("decimal must be greater than " + customOptions.exclusiveMinimum(), value);
		}
		if (customOptions.multipleOf() != null && d.remainder(customOptions.multipleOf()).signum() != 0) {
			return fail("decimal must be multiple of " + customOptions.multipleOf(), value);
		}
		return Result.ok(null);
	}

	private static Result<Void, List<ValidationError>> fail(String assertion, Object value) {
		return Result.failure(ValidationError.of(assertion, value));
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, DecimalOptions customOptions) {
		BigDecimal lower = firstNonNull(customOptions.minimum(), customOptions.exclusiveMinimum());
		BigDecimal upper = firstNonNull(customOptions.maximum(), customOptions.exclusiveMaximum());
		if (lower == null) {
			lower = (upper == null ? BigDecimal.ZERO : upper).subtract(DEFAULT_GENERATED_RANGE);
		}
		if (upper == null) {
			upper = lower.add(DEFAULT_GENERATED_RANGE.add(DEFAULT_GENERATED_RANGE));
		}
		int scale = customOptions.decimals() == null ? DEFAULT_GENERATED_DECIMALS : customOptions.decimals();
		BigDecimal from = lower;
		BigDecimal span = upper.subtract(lower);
		Arbitrary candidates;
		if (customOptions.multipleOf() != null) {
			BigDecimal step = customOptions.multipleOf();
			BigDecimal first = from.divide(step, 0, RoundingMode.CEILING);
			long count = span.divide(step, 0, RoundingMode.FLOOR).longValue() + 1;
			candidates = Arbitrary.integer(0, Math.max(0, count))
				.map(k -> first.add(BigDecimal.valueOf((Long) k)).multiply(step).setScale(Math.max(scale, step.scale()), RoundingMode.UNNECESSARY));
		} else {
			candidates = random -> from.add(span.multiply(BigDecimal.valueOf(random.nextDouble()))).setScale(scale, RoundingMode.HALF_UP);
		}
		return candidates.filter(d -> validate(d, ValidationOptions.DEFAULT, customOptions).isOk(), GENERATION_ATTEMPTS);
	}

	private static BigDecimal firstNonNull(BigDecimal a, BigDecimal b) {
		return a != null ? a : b;
	}
}
