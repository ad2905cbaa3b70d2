package works.strata.retrieve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.decoding.Decoder;
import works.strata.options.DecodingOptions;
import works.strata.options.FieldStrictness;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.retrieve.RetrieveError.Reason;
import works.strata.types.ArrayType;
import works.strata.types.BasicOptions;
import works.strata.types.ConcreteType;
import works.strata.types.EntityType;
import works.strata.types.FieldsType;
import works.strata.types.Kind;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.WrapperType;

/**
 * Derives the retrieve shape of an entity type and works with retrieve values.
 * <p>
 * A retrieve value is a map with any of these keys:
 * <dl>
 *     <dt>{@code select}</dt><dd>for each field, {@code true}, or for relations and embedded objects
 *         a nested map with its own {@code select}</dd>
 *     <dt>{@code where}</dt><dd>filters per field, combined with {@code AND}, {@code OR} and {@code NOT}</dd>
 *     <dt>{@code orderBy}</dt><dd>a list of maps from field to {@code "asc"} or {@code "desc"}</dd>
 *     <dt>{@code skip}, {@code take}</dt><dd>non-negative integers for pagination</dd>
 * </dl>
 */
public final class Retrieve {
	private Retrieve() { }

	/**
	 * @param type an entity type, possibly wrapped in arrays, optionals, nullables or references
	 * @return an object type against which callers' retrieve values can be decoded
	 */
	public static Result<Type, RetrieveError> deriveRetrieveType(Type type, RetrieveCapabilities capabilities) {
		if (capabilities.isEmpty()) {
			return Result.failure(new RetrieveError(Reason.NO_CAPABILITIES, "No retrieve capabilities requested"));
		}
		ConcreteType concrete = Types.unwrap(type);
		if (concrete.kind() != Kind.ENTITY) {
			return Result.failure(new RetrieveError(Reason.NOT_AN_ENTITY, "Retrieve requires an entity type; got " + concrete.displayName()));
		}
		try {
			Type result = new RetrieveTypeDeriver(capabilities.takeMax()).retrieve((EntityType) concrete, capabilities);
			LOGGER.debug("Derived retrieve type {} with {}", result, capabilities);
			return Result.ok(result);
		} catch (RetrieveTypeDeriver.UnsupportedShapeException e) {
			LOGGER.debug("Can't derive retrieve type for {}: {}", concrete, e.getMessage());
			return Result.failure(new RetrieveError(Reason.UNSUPPORTED_SHAPE, e.getMessage()));
		}
	}

	/**
	 * The type of the values that a retrieve with the given {@code select} produces.
	 * Relations and embedded objects selected with a nested map are trimmed recursively;
	 * fields selected with {@code true} keep their whole type.
	 *
	 * @param select null selects everything
	 */
	public static Type selectedType(Type type, @Nullable Map<String, ?> select) {
		if (select == null) {
			return type;
		}
		ConcreteType concrete = Types.concretise(type);
		return switch (concrete.kind()) {
			case OPTIONAL -> Types.optional(selectedType(((WrapperType) concrete).wrappedType(), select));
			case NULLABLE -> Types.nullable(selectedType(((WrapperType) concrete).wrappedType(), select));
			case REFERENCE -> Types.reference(selectedType(((WrapperType) concrete).wrappedType(), select));
			case ARRAY -> {
				ArrayType array = (ArrayType) concrete;
				yield new ArrayType(selectedType(array.wrappedType(), select), array.mutability(), array.options());
			}
			case OBJECT, ENTITY -> {
				Map<String, Type> fields = new LinkedHashMap<>();
				((FieldsType) concrete).fields().forEach((name, fieldType) -> {
					Object selection = select.get(name);
					if (Boolean.TRUE.equals(selection)) {
						fields.put(name, fieldType);
					} else if (selection instanceof Map<?, ?> nested && nested.get("select") instanceof Map<?, ?> nestedSelect) {
						fields.put(name, selectedType(fieldType, stringKeys(nestedSelect)));
					}
				});
				yield Types.object(fields, BasicOptions.NONE);
			}
			default -> concrete;
		};
	}

	public static @Nullable Map<String, Object> merge(Type type, @Nullable Map<String, ?> left, @Nullable Map<String, ?> right) {
		return merge(type, left, right, MergeOptions.DEFAULT);
	}

	/**
	 * Combines two retrieve values, for example an enforced base filter with a caller's request.
	 * <ul>
	 *     <li>{@code where} clauses are combined with {@code AND}.</li>
	 *     <li>{@code select} values are united, recursively through relations.</li>
	 *     <li>{@code orderBy} lists are concatenated.</li>
	 *     <li>{@code skip} and {@code take} come from whichever side is first, if present there.</li>
	 * </ul>
	 *
	 * @return null if both are null
	 */
	public static @Nullable Map<String, Object> merge(Type type, @Nullable Map<String, ?> left, @Nullable Map<String, ?> right, MergeOptions options) {
		return new RetrieveMerger(options).merge(type, left, right);
	}

	/**
	 * How many entities deep the selection reaches. Embedded objects don't add depth.
	 *
	 * @param retrieve null selects only the top level
	 */
	public static int selectionDepth(Type type, @Nullable Map<String, ?> retrieve) {
		ConcreteType concrete = Types.concretise(type);
		if (concrete instanceof WrapperType wrapper) {
			return selectionDepth(wrapper.wrappedType(), retrieve);
		} else if (concrete.kind() != Kind.ENTITY) {
			return 1;
		}
		Object select = retrieve == null ? null : retrieve.get("select");
		if (!(select instanceof Map<?, ?> selectMap)) {
			return 1;
		}
		int depth = 1;
		for (var field: ((EntityType) concrete).fields().entrySet()) {
			Object selection = selectMap.get(field.getKey());
			if (Types.unwrap(field.getValue()).kind() == Kind.ENTITY) {
				if (Boolean.TRUE.equals(selection)) {
					depth = Math.max(depth, 2);
				} else if (selection instanceof Map<?, ?> nested) {
					depth = Math.max(depth, 1 + selectionDepth(field.getValue(), stringKeys(nested)));
				}
			}
		}
		return depth;
	}

	/**
	 * Checks that {@code value} has the fields the retrieve selects, and trims away the rest.
	 *
	 * @return the trimmed value
	 */
	public static Result<Object, List<DecodingError>> isRespected(Type type, @Nullable Map<String, ?> retrieve, Object value) {
		Object select = retrieve == null ? null : retrieve.get("select");
		Type typeToRespect = (select instanceof Map<?, ?> selectMap)
			? selectedType(type, stringKeys(selectMap))
			: type;
		DecodingOptions options = DecodingOptions.DEFAULT.withFieldStrictness(FieldStrictness.ALLOW_ADDITIONAL_FIELDS);
		return new Decoder(options).decode(typeToRespect, value);
	}

	/**
	 * The type of {@code orderBy} directions.
	 */
	public static Type sortDirection() {
		return RetrieveTypeDeriver.SORT_DIRECTION;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> stringKeys(Map<?, ?> map) {
		return (Map<String, ?>) map;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Retrieve.class);
}
