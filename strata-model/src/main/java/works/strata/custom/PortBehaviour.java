package works.strata.custom;

import java.util.List;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;

final class PortBehaviour implements CustomBehaviour<Void> {
	static final PortBehaviour INSTANCE = new PortBehaviour();

	static final long MIN_PORT = 1;
	static final long MAX_PORT = 65535;

	private PortBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, Void customOptions) {
		if (raw instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()) && Double.isFinite(n.doubleValue())) {
			return Result.ok(n.longValue());
		} else if (options.tryCasting() && raw instanceof String s) {
			try {
				return Result.ok(Long.parseLong(s.trim()));
			} catch (NumberFormatException e) {
				return Result.failure(DecodingError.of("TCP port number", raw));
			}
		} else {
			return Result.failure(DecodingError.of("TCP port number", raw));
		}
	}

	@Override
	public Object encode(Object value, EncodingOptions options, Void customOptions) {
		return value;
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, Void customOptions) {
		long port = ((Number) value).longValue();
		if (port < MIN_PORT || port > MAX_PORT) {
			return Result.failure(ValidationError.of("TCP port number must be between " + MIN_PORT + " and " + MAX_PORT, value));
		}
		return Result.ok(null);
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, Void customOptions) {
		return Arbitrary.integer(MIN_PORT, MAX_PORT);
	}
}
