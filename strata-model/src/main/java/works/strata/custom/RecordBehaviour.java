package works.strata.custom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.strata.arbitrary.Arbitrary;
import works.strata.arbitrary.ArbitraryGenerator;
import works.strata.decoding.Decoder;
import works.strata.encoding.Encoder;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;
import works.strata.types.Type;
import works.strata.validation.Validator;

/**
 * A string-keyed map whose values all have the same type, given as the custom options.
 */
final class RecordBehaviour implements CustomBehaviour<Type> {
	static final RecordBehaviour INSTANCE = new RecordBehaviour();

	static final int MAX_GENERATED_KEYS = 4;

	private RecordBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, Type valueType) {
		if (!(raw instanceof Map<?, ?> map)) {
			return Result.failure(DecodingError.of("object", raw));
		}
		Decoder decoder = new Decoder(options);
		Map<String, Object> result = new LinkedHashMap<>();
		List<DecodingError> errors = new ArrayList<>();
		for (var entry: map.entrySet()) {
			String key = String.valueOf(entry.getKey());
			var decoded = decoder.decode(valueType, entry.getValue());
			if (decoded.isOk()) {
				result.put(key, decoded.value());
			} else {
				errors.addAll(DecodingError.prependField(decoded.error(), key));
				if (!options.allErrors()) {
					break;
				}
			}
		}
		return errors.isEmpty()
			? Result.ok(Collections.unmodifiableMap(result))
			: Result.failure(errors);
	}

	@Override
	public Object encode(Object value, EncodingOptions options, Type valueType) {
		Encoder encoder = new Encoder(options);
		Map<String, Object> result = new LinkedHashMap<>();
		((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), encoder.encode(valueType, v)));
		return Collections.unmodifiableMap(result);
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, Type valueType) {
		Validator validator = new Validator(options);
		List<ValidationError> errors = new ArrayList<>();
		for (var entry: ((Map<?, ?>) value).entrySet()) {
			var validated = validator.validate(valueType, entry.getValue());
			if (validated.isFailure()) {
				errors.addAll(ValidationError.prependField(validated.error(), String.valueOf(entry.getKey())));
				if (!options.allErrors()) {
					break;
				}
			}
		}
		return errors.isEmpty() ? Result.ok(null) : Result.failure(errors);
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, Type valueType) {
		if (maxDepth <= 0) {
			return Arbitrary.constant(Map.of());
		}
		Arbitrary values = ArbitraryGenerator.arbitrary(valueType, maxDepth - 1);
		return random -> {
			int size = random.nextInt(MAX_GENERATED_KEYS + 1);
			Map<String, Object> result = new LinkedHashMap<>();
			for (int i = 0; i < size; i++) {
				result.put("key" + random.nextInt(1000), values.generate(random));
			}
			return Collections.unmodifiableMap(result);
		};
	}
}
