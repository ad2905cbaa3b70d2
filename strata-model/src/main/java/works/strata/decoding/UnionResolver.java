package works.strata.decoding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.exceptions.TypeGraphException;
import works.strata.options.DecodingOptions;
import works.strata.options.ErrorReportingStrategy;
import works.strata.options.FieldStrictness;
import works.strata.options.TypeCastingStrategy;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.result.ValueError;
import works.strata.types.Type;
import works.strata.types.UnionType;
import works.strata.validation.Validator;

import static java.util.Objects.requireNonNull;
import static works.strata.result.Result.failure;
import static works.strata.result.Result.ok;

/**
 * Picks the variant of a {@link UnionType} that a value belongs to.
 * <p>
 * Candidates are tried in order: first the tagged form <code>{variantName: payload}</code>
 * if the input looks like one, then each variant in declaration order against the bare input.
 * The first candidate that both decodes and validates wins.
 * Failing that, the first candidate that merely decodes wins,
 * carrying its validation errors along for the caller to report.
 * Only if nothing decodes does resolution fail, with every candidate's errors.
 * <p>
 * When the decoder casts types or allows additional fields, the whole search is first
 * attempted with exact types and fields, so a lenient match can't shadow an exact one.
 */
public final class UnionResolver {
	private final Decoder decoder;
	private final Validator validator;

	public UnionResolver(Decoder decoder) {
		this(decoder, new Validator(decoder.options().validationOptions()));
	}

	public UnionResolver(Decoder decoder, Validator validator) {
		this.decoder = requireNonNull(decoder);
		this.validator = requireNonNull(validator);
	}

	/**
	 * @param value the decoded value, which may be {@link works.strata.types.Absent#VALUE absent}
	 * @param validationErrors empty if the value validates against the chosen variant
	 */
	public record Resolution(String variantName, Object value, List<ValidationError> validationErrors) {
		public boolean validated() {
			return validationErrors.isEmpty();
		}
	}

	/**
	 * @param acceptTagged whether <code>{variantName: payload}</code> is a candidate.
	 *                     Raw input may be tagged, but typed values never are.
	 */
	public Result<Resolution, List<DecodingError>> resolve(UnionType union, Object raw, boolean acceptTagged) {
		if (!acceptTagged && !decoder.typedInput()) {
			// Unions nested inside the variants mustn't accept the tagged form either
			return new UnionResolver(new Decoder(decoder.options(), true), validator).resolve(union, raw, false);
		}
		DecodingOptions options = decoder.options();
		if (options.tryCasting() || options.allowAdditionalFields()) {
			DecodingOptions exact = options
				.withTypeCastingStrategy(TypeCastingStrategy.EXPECT_EXACT_TYPES)
				.withFieldStrictness(FieldStrictness.EXPECT_EXACT_FIELDS);
			var exactResult = new UnionResolver(new Decoder(exact, decoder.typedInput()), validator).search(union, raw, acceptTagged);
			if (exactResult.isOk()) {
				return exactResult;
			}
			LOGGER.trace("No exact match in {}; trying again with {}", union, options);
		}
		return search(union, raw, acceptTagged);
	}

	private Result<Resolution, List<DecodingError>> search(UnionType union, Object raw, boolean acceptTagged) {
		List<Candidate> candidates = new ArrayList<>();
		if (acceptTagged && raw instanceof Map<?, ?> map && map.size() == 1) {
			var entry = map.entrySet().iterator().next();
			String key = String.valueOf(entry.getKey());
			Type variant = union.variants().get(key);
			if (variant != null) {
				candidates.add(new Candidate(key, variant, entry.getValue(), true));
			}
		}
		union.variants().forEach((name, variant) -> candidates.add(new Candidate(name, variant, raw, false)));

		List<DecodingError> decodingErrors = new ArrayList<>();
		Resolution potential = null;
		for (Candidate candidate: candidates) {
			var decoded = decoder.decodeValue(candidate.type(), candidate.raw());
			if (decoded.isOk()) {
				// Look ahead with validation so we prefer a variant the value actually satisfies
				var validated = validator.validate(candidate.type(), Decoder.absentToNull(decoded.value()));
				if (validated.isOk()) {
					LOGGER.trace("Resolved {} as variant \"{}\"", union, candidate.name());
					return ok(new Resolution(candidate.name(), decoded.value(), List.of()));
				} else if (potential == null) {
					potential = new Resolution(
						candidate.name(),
						decoded.value(),
						ValidationError.prependVariant(validated.error(), candidate.name()));
				}
			} else if (candidate.tagged()) {
				decodingErrors.addAll(DecodingError.prependField(decoded.error(), candidate.name()));
			} else {
				decodingErrors.addAll(DecodingError.prependVariant(decoded.error(), candidate.name()));
			}
		}
		if (potential != null) {
			LOGGER.debug("Value decodes as variant \"{}\" of {} but fails validation: {}",
				potential.variantName(), union, ValueError.describe(potential.validationErrors()));
			return ok(potential);
		}
		return failure(decodingErrors);
	}

	/**
	 * Classifies an already-decoded value.
	 *
	 * @throws TypeGraphException if the value belongs to no variant
	 */
	public static String variantOwnership(UnionType union, Object value) {
		DecodingOptions exact = new DecodingOptions(
			TypeCastingStrategy.EXPECT_EXACT_TYPES,
			ErrorReportingStrategy.STOP_AT_FIRST_ERROR,
			FieldStrictness.EXPECT_EXACT_FIELDS);
		var result = new UnionResolver(new Decoder(exact, true), new Validator(ValidationOptions.DEFAULT))
			.resolve(union, value, false);
		if (result.isOk()) {
			return result.value().variantName();
		} else {
			throw new TypeGraphException("Value belongs to no variant of " + union + ": " + ValueError.describe(result.error()));
		}
	}

	private record Candidate(String name, Type type, Object raw, boolean tagged) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(UnionResolver.class);
}
