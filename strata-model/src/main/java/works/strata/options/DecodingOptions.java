package works.strata.options;

import lombok.Builder;
import lombok.With;

import static java.util.Objects.requireNonNull;

@With
@Builder(toBuilder = true)
public record DecodingOptions(
	TypeCastingStrategy typeCastingStrategy,
	ErrorReportingStrategy errorReportingStrategy,
	FieldStrictness fieldStrictness
) {
	public static final DecodingOptions DEFAULT = new DecodingOptions(
		TypeCastingStrategy.EXPECT_EXACT_TYPES,
		ErrorReportingStrategy.STOP_AT_FIRST_ERROR,
		FieldStrictness.EXPECT_EXACT_FIELDS);

	/**
	 * As lenient as possible: casts types and ignores unknown fields.
	 */
	public static final DecodingOptions LENIENT = new DecodingOptions(
		TypeCastingStrategy.TRY_CASTING,
		ErrorReportingStrategy.STOP_AT_FIRST_ERROR,
		FieldStrictness.ALLOW_ADDITIONAL_FIELDS);

	public DecodingOptions {
		requireNonNull(typeCastingStrategy);
		requireNonNull(errorReportingStrategy);
		requireNonNull(fieldStrictness);
	}

	public boolean tryCasting() {
		return typeCastingStrategy == TypeCastingStrategy.TRY_CASTING;
	}

	public boolean allErrors() {
		return errorReportingStrategy == ErrorReportingStrategy.ALL_ERRORS;
	}

	public boolean allowAdditionalFields() {
		return fieldStrictness == FieldStrictness.ALLOW_ADDITIONAL_FIELDS;
	}

	/**
	 * The options to use for validation performed as part of decoding.
	 */
	public ValidationOptions validationOptions() {
		return new ValidationOptions(errorReportingStrategy);
	}
}
