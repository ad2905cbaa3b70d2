package works.strata.custom;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
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
 * ISO-8601 on the wire. With casting, epoch milliseconds are accepted too.
 */
final class DateTimeBehaviour implements CustomBehaviour<DateTimeOptions> {
	static final DateTimeBehaviour INSTANCE = new DateTimeBehaviour();

	/**
	 * The end of year 9999, beyond which ISO strings need a sign.
	 */
	static final long MAX_GENERATED_MILLIS = 253402300799999L;

	private DateTimeBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, DateTimeOptions customOptions) {
		if (raw instanceof Instant) {
			return Result.ok(raw);
		} else if (raw instanceof String s) {
			try {
				return Result.ok(OffsetDateTime.parse(s).toInstant());
			} catch (DateTimeParseException e) {
				return Result.failure(DecodingError.of("ISO date expected", raw));
			}
		} else if (options.tryCasting() && raw instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
			return Result.ok(Instant.ofEpochMilli(n.longValue()));
		} else {
			return Result.failure(DecodingError.of("ISO date expected", raw));
		}
	}

	@Override
	public Object encode(Object value, EncodingOptions options, DateTimeOptions customOptions) {
		return value.toString();
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, DateTimeOptions customOptions) {
		return validateRange((Instant) value, customOptions, "datetime");
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, DateTimeOptions customOptions) {
		return arbitraryInstant(customOptions);
	}

	static Result<Void, List<ValidationError>> validateRange(Instant value, DateTimeOptions range, String what) {
		if (range.maximum() != null && value.isAfter(range.maximum())) {
			return Result.failure(ValidationError.of(what + " must be maximum " + range.maximum(), value));
		}
		if (range.minimum() != null && value.isBefore(range.minimum())) {
			return Result.failure(ValidationError.of(what + " must be minimum " + range.minimum(), value));
		}
		return Result.ok(null);
	}

	/**
	 * Millisecond precision, so values survive a round trip through any of the wire formats.
	 */
	static Arbitrary arbitraryInstant(DateTimeOptions range) {
		long min = range.minimum() == null ? 0 : ceilMillis(range.minimum());
		long max = range.maximum() == null ? MAX_GENERATED_MILLIS : range.maximum().toEpochMilli();
		return Arbitrary.integer(min, Math.max(min, max)).map(millis -> Instant.ofEpochMilli((Long) millis));
	}

	private static long ceilMillis(Instant instant) {
		long millis = instant.toEpochMilli();
		return Instant.ofEpochMilli(millis).isBefore(instant) ? millis + 1 : millis;
	}
}
