package works.strata.encoding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.decoding.UnionResolver;
import works.strata.exceptions.TypeGraphException;
import works.strata.options.EncodingOptions;
import works.strata.options.EncodingOptions.SensitiveInformationStrategy;
import works.strata.types.Absent;
import works.strata.types.ArrayType;
import works.strata.types.ConcreteType;
import works.strata.types.CustomType;
import works.strata.types.FieldsType;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.UnionType;
import works.strata.types.WrapperType;

import static java.util.Objects.requireNonNull;

/**
 * Turns a typed value into a wire value that a JSON library could write directly.
 * <p>
 * The value is assumed to be valid. To encode untrusted values, validate them first,
 * as {@link works.strata.Strata#validateAndEncode} does.
 */
public final class Encoder {
	private final EncodingOptions options;

	public Encoder(EncodingOptions options) {
		this.options = requireNonNull(options);
	}

	/**
	 * @throws TypeGraphException if the value doesn't have the shape the type calls for
	 */
	public Object encode(Type type, Object value) {
		ConcreteType concrete = Types.concretise(type);
		if (options.sensitiveInformationStrategy() == SensitiveInformationStrategy.HIDE && concrete.options().sensitive()) {
			return null;
		}
		return switch (concrete.kind()) {
			case STRING, NUMBER, BOOLEAN, LITERAL, ENUM -> value;
			case OBJECT, ENTITY -> encodeFields((FieldsType) concrete, value);
			case ARRAY -> encodeArray((ArrayType) concrete, value);
			case OPTIONAL, NULLABLE -> (value == null || value == Absent.VALUE)
				? null
				: encode(((WrapperType) concrete).wrappedType(), value);
			case REFERENCE -> encode(((WrapperType) concrete).wrappedType(), value);
			case UNION -> encodeUnion((UnionType) concrete, value);
			case CUSTOM -> encodeCustom((CustomType<?>) concrete, value);
		};
	}

	private Map<String, Object> encodeFields(FieldsType type, Object value) {
		if (!(value instanceof Map<?, ?> map)) {
			throw new TypeGraphException("Expected a map for " + type + "; got " + describe(value));
		}
		Map<String, Object> result = new LinkedHashMap<>();
		type.fields().forEach((name, fieldType) -> {
			Object fieldValue = map.containsKey(name) ? map.get(name) : Absent.VALUE;
			Object encoded = encode(fieldType, fieldValue);
			if (encoded != null || !Types.isOptional(fieldType)) {
				result.put(name, encoded);
			}
		});
		return Collections.unmodifiableMap(result);
	}

	private List<Object> encodeArray(ArrayType type, Object value) {
		if (!(value instanceof List<?> list)) {
			throw new TypeGraphException("Expected a list for " + type + "; got " + describe(value));
		}
		List<Object> result = new ArrayList<>(list.size());
		for (Object element: list) {
			result.add(encode(type.wrappedType(), element));
		}
		return Collections.unmodifiableList(result);
	}

	private Map<String, Object> encodeUnion(UnionType type, Object value) {
		String variant = UnionResolver.variantOwnership(type, value);
		LOGGER.trace("Encoding {} as variant \"{}\"", type, variant);
		return Collections.singletonMap(variant, encode(type.variants().get(variant), value));
	}

	private <O> Object encodeCustom(CustomType<O> type, Object value) {
		return type.behaviour().encode(value, options, type.customOptions());
	}

	private static String describe(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Encoder.class);
}
