package works.strata.decoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.options.DecodingOptions;
import works.strata.path.Path;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.types.Absent;
import works.strata.types.ArrayType;
import works.strata.types.BooleanType;
import works.strata.types.ConcreteType;
import works.strata.types.CustomType;
import works.strata.types.EnumType;
import works.strata.types.FieldsType;
import works.strata.types.LiteralType;
import works.strata.types.Mutability;
import works.strata.types.NullableType;
import works.strata.types.NumberType;
import works.strata.types.OptionalType;
import works.strata.types.ReferenceType;
import works.strata.types.StringType;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.UnionType;

import static java.util.Objects.requireNonNull;
import static works.strata.result.Result.failure;
import static works.strata.result.Result.ok;

/**
 * Turns raw input into a typed value, checking only its shape.
 * Constraints like string lengths and number bounds are the
 * {@link works.strata.validation.Validator Validator}'s job.
 * <p>
 * Raw input is built from null, {@link Absent#VALUE}, {@link String}, {@link Number},
 * {@link Boolean}, {@link List}, and {@link Map} with string keys.
 * Decoding never throws on bad input; every problem is reported as a {@link DecodingError}.
 */
public final class Decoder {
	private final DecodingOptions options;
	private final boolean typedInput;

	public Decoder(DecodingOptions options) {
		this(options, false);
	}

	/**
	 * @param typedInput the input is an already-decoded value rather than raw input,
	 *                   so no union within it is ever in the tagged form
	 */
	public Decoder(DecodingOptions options, boolean typedInput) {
		this.options = requireNonNull(options);
		this.typedInput = typedInput;
	}

	public DecodingOptions options() {
		return options;
	}

	public boolean typedInput() {
		return typedInput;
	}

	/**
	 * @return the typed value, with a top-level absent value represented as null
	 */
	public Result<Object, List<DecodingError>> decode(Type type, Object raw) {
		LOGGER.trace("decode({}, {})", type, raw);
		return decodeValue(type, raw).map(Decoder::absentToNull);
	}

	/**
	 * Like {@link #decode} except an absent result is returned as {@link Absent#VALUE},
	 * so the caller can tell it apart from null.
	 */
	Result<Object, List<DecodingError>> decodeValue(Type type, Object raw) {
		ConcreteType concrete = Types.concretise(type);
		return switch (concrete.kind()) {
			case STRING -> decodeString((StringType) concrete, raw);
			case NUMBER -> decodeNumber((NumberType) concrete, raw);
			case BOOLEAN -> decodeBoolean((BooleanType) concrete, raw);
			case LITERAL -> decodeLiteral((LiteralType) concrete, raw);
			case ENUM -> decodeEnum((EnumType) concrete, raw);
			case OBJECT, ENTITY -> decodeFields((FieldsType) concrete, raw);
			case ARRAY -> decodeArray((ArrayType) concrete, raw);
			case OPTIONAL -> decodeOptional((OptionalType) concrete, raw);
			case NULLABLE -> decodeNullable((NullableType) concrete, raw);
			case REFERENCE -> decodeValue(((ReferenceType) concrete).wrappedType(), raw);
			case UNION -> decodeUnion((UnionType) concrete, raw);
			case CUSTOM -> decodeCustom((CustomType<?>) concrete, raw);
		};
	}

	private Result<Object, List<DecodingError>> decodeString(StringType type, Object raw) {
		if (raw instanceof String) {
			return ok(raw);
		} else if (options.tryCasting() && raw instanceof Number n) {
			return ok(Casting.numberToString(n));
		} else if (options.tryCasting() && raw instanceof Boolean b) {
			return ok(b.toString());
		} else {
			return fail("string", raw);
		}
	}

	private Result<Object, List<DecodingError>> decodeNumber(NumberType type, Object raw) {
		Optional<Number> result = Optional.empty();
		if (raw instanceof Number n) {
			result = Casting.normalizeNumber(n);
		} else if (options.tryCasting() && raw instanceof String s) {
			result = Casting.numberFromString(s);
		}
		if (result.isPresent()) {
			return ok(result.get());
		} else {
			return fail(type.isInteger() ? "integer" : "number", raw);
		}
	}

	private Result<Object, List<DecodingError>> decodeBoolean(BooleanType type, Object raw) {
		if (raw instanceof Boolean) {
			return ok(raw);
		} else if (options.tryCasting()) {
			Optional<Boolean> cast = Casting.booleanFrom(raw);
			if (cast.isPresent()) {
				return ok(cast.get());
			}
		}
		return fail("boolean", raw);
	}

	private Result<Object, List<DecodingError>> decodeLiteral(LiteralType type, Object raw) {
		Object literal = type.value();
		if (literal == null) {
			if (raw == null || (options.tryCasting() && "null".equals(raw))) {
				return ok(null);
			}
		} else if (literal instanceof Number expected) {
			if (raw instanceof Number actual && Casting.numericEquals(expected, actual)) {
				return ok(literal);
			}
		} else if (literal.equals(raw)) {
			return ok(literal);
		}
		return fail("literal (" + literal + ")", raw);
	}

	private Result<Object, List<DecodingError>> decodeEnum(EnumType type, Object raw) {
		if (raw instanceof String s && type.variants().contains(s)) {
			return ok(s);
		} else {
			return fail("enum (" + String.join(" | ", type.variants().stream().map(v -> "\"" + v + "\"").toList()) + ")", raw);
		}
	}

	private Result<Object, List<DecodingError>> decodeFields(FieldsType type, Object raw) {
		Map<?, ?> input;
		if (raw instanceof Map<?, ?> map) {
			input = map;
		} else if (raw == null && options.tryCasting()) {
			input = Map.of();
		} else {
			return fail("object", raw);
		}

		List<DecodingError> errors = new ArrayList<>();
		if (!options.allowAdditionalFields() && !options.allErrors()) {
			// Fail fast on unexpected keys before decoding anything
			for (var entry: input.entrySet()) {
				String key = String.valueOf(entry.getKey());
				if (!type.fields().containsKey(key)) {
					return failure(List.of(new DecodingError(
						Path.ofField(key), "undefined", entry.getValue())));
				}
			}
		}

		Map<String, Object> result = new LinkedHashMap<>();
		for (var field: type.fields().entrySet()) {
			String name = field.getKey();
			Object fieldRaw = input.containsKey(name) ? input.get(name) : Absent.VALUE;
			var decoded = decodeValue(field.getValue(), fieldRaw);
			if (decoded.isOk()) {
				if (decoded.value() != Absent.VALUE) {
					result.put(name, decoded.value());
				}
			} else {
				errors.addAll(DecodingError.prependField(decoded.error(), name));
				if (!options.allErrors()) {
					return failure(errors);
				}
			}
		}

		if (!options.allowAdditionalFields()) {
			for (var entry: input.entrySet()) {
				String key = String.valueOf(entry.getKey());
				if (!type.fields().containsKey(key)) {
					errors.add(new DecodingError(Path.ofField(key), "undefined", entry.getValue()));
				}
			}
		}

		if (errors.isEmpty()) {
			return ok(type.mutability() == Mutability.MUTABLE ? result : Collections.unmodifiableMap(result));
		} else {
			return failure(errors);
		}
	}

	private Result<Object, List<DecodingError>> decodeArray(ArrayType type, Object raw) {
		List<?> input;
		if (raw instanceof List<?> list) {
			input = list;
		} else if (options.tryCasting() && raw instanceof Map<?, ?> map) {
			input = listFromIndexedMap(map);
			if (input == null) {
				return fail("array", raw);
			}
		} else {
			return fail("array", raw);
		}

		List<Object> result = new ArrayList<>(input.size());
		List<DecodingError> errors = new ArrayList<>();
		for (int i = 0; i < input.size(); i++) {
			var decoded = decodeValue(type.wrappedType(), input.get(i));
			if (decoded.isOk()) {
				result.add(absentToNull(decoded.value()));
			} else {
				errors.addAll(DecodingError.prependIndex(decoded.error(), i));
				if (!options.allErrors()) {
					break;
				}
			}
		}

		if (errors.isEmpty()) {
			return ok(type.mutability() == Mutability.MUTABLE ? result : Collections.unmodifiableList(result));
		} else {
			return failure(errors);
		}
	}

	/**
	 * @return null unless the keys are exactly the integers 0..n-1
	 */
	private static List<?> listFromIndexedMap(Map<?, ?> map) {
		Object[] elements = new Object[map.size()];
		boolean[] seen = new boolean[map.size()];
		for (var entry: map.entrySet()) {
			int index;
			try {
				index = Integer.parseInt(String.valueOf(entry.getKey()));
			} catch (NumberFormatException e) {
				return null;
			}
			if (index < 0 || index >= elements.length || seen[index]) {
				return null;
			}
			seen[index] = true;
			elements[index] = entry.getValue();
		}
		return Arrays.asList(elements);
	}

	private Result<Object, List<DecodingError>> decodeOptional(OptionalType type, Object raw) {
		if (raw == Absent.VALUE) {
			return ok(Absent.VALUE);
		}
		var decoded = decodeValue(type.wrappedType(), raw);
		if (decoded.isOk()) {
			return decoded;
		} else if (raw == null) {
			// Null is an acceptable way to say "absent"
			return ok(Absent.VALUE);
		} else {
			return failure(appendToExpected(decoded.error(), "undefined", true));
		}
	}

	private Result<Object, List<DecodingError>> decodeNullable(NullableType type, Object raw) {
		if (raw == null || (raw == Absent.VALUE && options.tryCasting())) {
			return ok(null);
		}
		return decodeValue(type.wrappedType(), raw)
			.mapError(errors -> appendToExpected(errors, "null", false));
	}

	private Result<Object, List<DecodingError>> decodeUnion(UnionType type, Object raw) {
		return new UnionResolver(this)
			.resolve(type, raw, !typedInput)
			.map(UnionResolver.Resolution::value);
	}

	private <O> Result<Object, List<DecodingError>> decodeCustom(CustomType<O> type, Object raw) {
		if (raw == Absent.VALUE) {
			return fail(type.displayName(), raw);
		}
		return type.behaviour().decode(raw, options, type.customOptions());
	}

	/**
	 * Amends every error, wherever it is located, except those that already expect {@code alternative}
	 * when {@code unlessExpected} is set.
	 * An error deep inside an optional object reads as {@code "string or undefined"} too.
	 */
	private static List<DecodingError> appendToExpected(List<DecodingError> errors, String alternative, boolean unlessExpected) {
		return errors.stream()
			.map(e -> (unlessExpected && e.expected().equals(alternative))
				? e
				: e.withExpected(e.expected() + " or " + alternative))
			.toList();
	}

	static Object absentToNull(Object value) {
		return value == Absent.VALUE ? null : value;
	}

	private static Result<Object, List<DecodingError>> fail(String expected, Object got) {
		return failure(DecodingError.of(expected, got));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Decoder.class);
}
