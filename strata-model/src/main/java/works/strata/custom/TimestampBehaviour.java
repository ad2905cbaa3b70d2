package works.strata.custom;

import java.time.Instant;
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
 * Milliseconds since the epoch on the wire.
 */
final class TimestampBehaviour implements CustomBehaviour<DateTimeOptions> {
	static final TimestampBehaviour INSTANCE = new TimestampBehaviour();

	private TimestampBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, DateTimeOptions customOptions) {
		if (raw instanceof Instant) {
			return Result.ok(raw);
		} else if (raw instanceof Number n && isIntegral(n)) {
			return Result.ok(Instant.ofEpochMilli(n.longValue()));
		} else if (options.tryCasting() && raw instanceof String s) {
			try {
				return Result.ok(Instant.ofEpochMilli(Long.parseLong(s.trim())));
			} catch (NumberFormatException e) {
				return Result.failure(DecodingError.of("timestamp", raw));
			}
		} else {
			return Result.failure(DecodingError.of("timestamp", raw));
		}
	}

	@Override
	public Object encode(Object value, EncodingOptions options, DateTimeOptions customOptions) {
		return ((Instant) value).toEpochMilli();
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, DateTimeOptions customOptions) {
		return DateTimeBehaviour.validateRange((Instant) value, customOptions, "timestamp");
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, DateTimeOptions customOptions) {
		return DateTimeBehaviour.arbitraryInstant(customOptions);
	}

	private static boolean isIntegral(Number n) {
		double d = n.doubleValue();
		return Double.isFinite(d) && d == Math.rint(d);
	}
}
