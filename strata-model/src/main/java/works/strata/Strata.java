package works.strata;

import java.util.List;
import works.strata.arbitrary.Arbitrary;
import works.strata.arbitrary.ArbitraryGenerator;
import works.strata.decoding.Decoder;
import works.strata.decoding.UnionResolver;
import works.strata.encoding.Encoder;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.result.ValueError;
import works.strata.types.Type;
import works.strata.types.UnionType;
import works.strata.validation.Validator;

/**
 * The operations that collaborators use to work with typed data.
 * <p>
 * Typed values are built from:
 * <ul>
 *     <li>{@link String} for strings and enum variants,</li>
 *     <li>{@link Long} for integral numbers and {@link Double} for the rest,</li>
 *     <li>{@link Boolean},</li>
 *     <li>{@link List} for arrays,</li>
 *     <li>{@link java.util.Map Map}&lt;String, Object&gt; for objects and entities,
 *         with absent optional fields omitted,</li>
 *     <li>null, for null values and for absent optionals outside objects, and</li>
 *     <li>whatever Java object a custom type decodes to.</li>
 * </ul>
 * Union values carry no tag; the variant is recovered by {@link #variantOwnership}.
 */
public final class Strata {
	private Strata() { }

	public static Result<Object, List<DecodingError>> decode(Type type, Object raw) {
		return decode(type, raw, DecodingOptions.DEFAULT);
	}

	/**
	 * Checks the shape of the input only. Use {@link #decodeAndValidate} to check constraints too.
	 */
	public static Result<Object, List<DecodingError>> decode(Type type, Object raw, DecodingOptions options) {
		return new Decoder(options).decode(type, raw);
	}

	public static Result<Void, List<ValidationError>> validate(Type type, Object value) {
		return validate(type, value, ValidationOptions.DEFAULT);
	}

	public static Result<Void, List<ValidationError>> validate(Type type, Object value, ValidationOptions options) {
		return new Validator(options).validate(type, value);
	}

	public static Result<Object, List<? extends ValueError>> decodeAndValidate(Type type, Object raw) {
		return decodeAndValidate(type, raw, DecodingOptions.DEFAULT);
	}

	/**
	 * @return the decoding errors if decoding fails; otherwise the validation errors if validation fails
	 */
	public static Result<Object, List<? extends ValueError>> decodeAndValidate(Type type, Object raw, DecodingOptions options) {
		var decoded = decode(type, raw, options);
		if (decoded.isFailure()) {
			return Result.failure(decoded.error());
		}
		var validated = validate(type, decoded.value(), options.validationOptions());
		if (validated.isFailure()) {
			return Result.failure(validated.error());
		}
		return Result.ok(decoded.value());
	}

	public static Object encode(Type type, Object value) {
		return encode(type, value, EncodingOptions.DEFAULT);
	}

	/**
	 * Assumes the value is valid.
	 */
	public static Object encode(Type type, Object value, EncodingOptions options) {
		return new Encoder(options).encode(type, value);
	}

	public static Result<Object, List<ValidationError>> validateAndEncode(Type type, Object value) {
		return validateAndEncode(type, value, ValidationOptions.DEFAULT, EncodingOptions.DEFAULT);
	}

	public static Result<Object, List<ValidationError>> validateAndEncode(Type type, Object value, ValidationOptions validationOptions, EncodingOptions encodingOptions) {
		return validate(type, value, validationOptions)
			.map(ignored -> encode(type, value, encodingOptions));
	}

	public static Arbitrary arbitrary(Type type) {
		return ArbitraryGenerator.arbitrary(type);
	}

	public static Arbitrary arbitrary(Type type, int maxDepth) {
		return ArbitraryGenerator.arbitrary(type, maxDepth);
	}

	/**
	 * @return {@code count} values; the same seed gives the same values
	 */
	public static List<Object> arbitrary(Type type, long seed, int maxDepth, int count) {
		return ArbitraryGenerator.arbitrary(type, maxDepth).sample(seed, count);
	}

	/**
	 * @return the name of the variant of {@code union} that {@code value} belongs to
	 * @throws works.strata.exceptions.TypeGraphException if it belongs to none
	 */
	public static String variantOwnership(UnionType union, Object value) {
		return UnionResolver.variantOwnership(union, value);
	}
}
