package works.strata.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.decoding.Decoder;
import works.strata.decoding.UnionResolver;
import works.strata.options.DecodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.path.Path;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.Absent;
import works.strata.types.ArrayType;
import works.strata.types.ConcreteType;
import works.strata.types.CustomType;
import works.strata.types.FieldsType;
import works.strata.types.NumberOptions;
import works.strata.types.NumberType;
import works.strata.types.StringOptions;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.UnionType;
import works.strata.types.WrapperType;

import static java.util.Objects.requireNonNull;

/**
 * Checks the semantic constraints of an already-decoded value:
 * number bounds, string lengths and patterns, array sizes, and custom rules.
 * <p>
 * Only the fields actually present in an object are checked,
 * so partial or projected values can be validated too.
 */
public final class Validator {
	private final ValidationOptions options;

	public Validator(ValidationOptions options) {
		this.options = requireNonNull(options);
	}

	public Result<Void, List<ValidationError>> validate(Type type, Object value) {
		List<ValidationError> errors = errorsFor(type, value);
		if (errors.isEmpty()) {
			return Result.ok(null);
		} else {
			LOGGER.trace("Validation failed: {}", errors);
			return Result.failure(errors);
		}
	}

	private List<ValidationError> errorsFor(Type type, Object value) {
		ConcreteType concrete = Types.concretise(type);
		return switch (concrete.kind()) {
			case STRING -> {
				if (value instanceof String s) {
					yield checkString(((StringOptions) concrete.options()), s);
				} else {
					yield shapeMismatch(concrete, value);
				}
			}
			case NUMBER -> {
				if (value instanceof Number n) {
					yield checkNumber(((NumberType) concrete).options(), n);
				} else {
					yield shapeMismatch(concrete, value);
				}
			}
			case BOOLEAN, LITERAL, ENUM -> List.of();
			case OBJECT, ENTITY -> {
				if (value instanceof Map<?, ?> map) {
					yield checkFields((FieldsType) concrete, map);
				} else {
					yield shapeMismatch(concrete, value);
				}
			}
			case ARRAY -> {
				if (value instanceof List<?> list) {
					yield checkArray((ArrayType) concrete, list);
				} else {
					yield shapeMismatch(concrete, value);
				}
			}
			case OPTIONAL, NULLABLE -> {
				if (value == null || value == Absent.VALUE) {
					yield List.of();
				} else {
					yield errorsFor(((WrapperType) concrete).wrappedType(), value);
				}
			}
			case REFERENCE -> errorsFor(((WrapperType) concrete).wrappedType(), value);
			case UNION -> checkUnion((UnionType) concrete, value);
			case CUSTOM -> checkCustom((CustomType<?>) concrete, value);
		};
	}

	private List<ValidationError> checkString(StringOptions constraints, String value) {
		Checks checks = new Checks(value);
		Integer maxLength = constraints.maxLength();
		if (maxLength != null && value.length() > maxLength) {
			checks.fail("string longer than max length (" + maxLength + ")");
		}
		Integer minLength = constraints.minLength();
		if (checks.shouldContinue() && minLength != null && value.length() < minLength) {
			checks.fail("string shorter than min length (" + minLength + ")");
		}
		if (checks.shouldContinue() && constraints.regex() != null && !constraints.regex().matcher(value).matches()) {
			checks.fail("string regex mismatch (" + constraints.regex().pattern() + ")");
		}
		return checks.errors();
	}

	private List<ValidationError> checkNumber(NumberOptions constraints, Number value) {
		Checks checks = new Checks(value);
		double d = value.doubleValue();
		if (constraints.maximum() != null && !(d <= constraints.maximum())) {
			checks.fail("number must be less than or equal to " + format(constraints.maximum()));
		}
		if (checks.shouldContinue() && constraints.exclusiveMaximum() != null && !(d < constraints.exclusiveMaximum())) {
			checks.fail("number must be less than " + format(constraints.exclusiveMaximum()));
		}
		if (checks.shouldContinue() && constraints.minimum() != null && !(d >= constraints.minimum())) {
			checks.fail("number must be greater than or equal to " + format(constraints.minimum()));
		}
		if (checks.shouldContinue() && constraints.exclusiveMinimum() != null && !(d > constraints.exclusiveMinimum())) {
			checks.fail("number must be greater than " + format(constraints.exclusiveMinimum()));
		}
		if (checks.shouldContinue() && constraints.isInteger() && !isIntegral(value)) {
			checks.fail("number must be an integer");
		}
		return checks.errors();
	}

	private List<ValidationError> checkArray(ArrayType type, List<?> value) {
		Checks checks = new Checks(value.size());
		Integer maxItems = type.options().maxItems();
		if (maxItems != null && value.size() > maxItems) {
			checks.fail("array must have at most " + maxItems + " items");
		}
		Integer minItems = type.options().minItems();
		if (checks.shouldContinue() && minItems != null && value.size() < minItems) {
			checks.fail("array must have at least " + minItems + " items");
		}
		List<ValidationError> errors = new ArrayList<>(checks.errors());
		for (int i = 0; i < value.size() && (errors.isEmpty() || options.allErrors()); i++) {
			errors.addAll(ValidationError.prependIndex(errorsFor(type.wrappedType(), value.get(i)), i));
		}
		return errors;
	}

	private List<ValidationError> checkFields(FieldsType type, Map<?, ?> value) {
		List<ValidationError> errors = new ArrayList<>();
		for (var field: type.fields().entrySet()) {
			if (!errors.isEmpty() && !options.allErrors()) {
				break;
			}
			if (value.containsKey(field.getKey())) {
				errors.addAll(ValidationError.prependField(
					errorsFor(field.getValue(), value.get(field.getKey())),
					field.getKey()));
			}
		}
		return errors;
	}

	private List<ValidationError> checkUnion(UnionType type, Object value) {
		DecodingOptions decodingOptions = DecodingOptions.DEFAULT.withErrorReportingStrategy(options.errorReportingStrategy());
		var resolved = new UnionResolver(new Decoder(decodingOptions, true), this).resolve(type, value, false);
		if (resolved.isOk()) {
			return resolved.value().validationErrors();
		} else {
			return ValidationError.of("value matching one of the variants " + type.variants().keySet(), value);
		}
	}

	private <O> List<ValidationError> checkCustom(CustomType<O> type, Object value) {
		var result = type.behaviour().validate(value, options, type.customOptions());
		return result.isOk() ? List.of() : result.error();
	}

	private static List<ValidationError> shapeMismatch(ConcreteType type, Object value) {
		return ValidationError.of("value of kind " + type.kind().name().toLowerCase(), value);
	}

	private static boolean isIntegral(Number value) {
		if (value instanceof Double || value instanceof Float) {
			double d = value.doubleValue();
			return Double.isFinite(d) && d == Math.rint(d);
		} else {
			return true;
		}
	}

	private static String format(double bound) {
		if (bound == Math.rint(bound) && Math.abs(bound) < 1e15) {
			return Long.toString((long) bound);
		} else {
			return Double.toString(bound);
		}
	}

	/**
	 * Accumulates failed assertions about a single value,
	 * honouring the {@link works.strata.options.ErrorReportingStrategy}.
	 */
	private final class Checks {
		private final Object got;
		private final List<ValidationError> errors = new ArrayList<>();

		Checks(Object got) {
			this.got = got;
		}

		void fail(String assertion) {
			errors.add(new ValidationError(Path.root(), assertion, got));
		}

		boolean shouldContinue() {
			return errors.isEmpty() || options.allErrors();
		}

		List<ValidationError> errors() {
			return errors;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Validator.class);
}
