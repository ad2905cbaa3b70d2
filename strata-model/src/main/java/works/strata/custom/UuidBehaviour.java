package works.strata.custom;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;

final class UuidBehaviour implements CustomBehaviour<Void> {
	static final UuidBehaviour INSTANCE = new UuidBehaviour();

	// UUID.fromString is more lenient than this
	private static final Pattern CANONICAL = Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

	private UuidBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, Void customOptions) {
		if (raw instanceof UUID) {
			return Result.ok(raw);
		} else if (raw instanceof String s && CANONICAL.matcher(s).matches()) {
			return Result.ok(UUID.fromString(s));
		} else {
			return Result.failure(DecodingError.of("UUID", raw));
		}
	}

	@Override
	public Object encode(Object value, EncodingOptions options, Void customOptions) {
		return value.toString();
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, Void customOptions) {
		return Result.ok(null);
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, Void customOptions) {
		return random -> new UUID(random.nextLong(), random.nextLong());
	}
}
