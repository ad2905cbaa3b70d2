package works.strata.retrieve;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.types.ArrayType;
import works.strata.types.BasicOptions;
import works.strata.types.ConcreteType;
import works.strata.types.EntityType;
import works.strata.types.Kind;
import works.strata.types.NumberOptions;
import works.strata.types.ObjectType;
import works.strata.types.Type;
import works.strata.types.Types;

import static works.strata.types.Types.array;
import static works.strata.types.Types.bool;
import static works.strata.types.Types.integer;
import static works.strata.types.Types.members;
import static works.strata.types.Types.object;
import static works.strata.types.Types.optional;
import static works.strata.types.Types.union;

/**
 * Builds the select, where and orderBy types for one entity type.
 * <p>
 * Entity types may refer to each other in cycles, so each derived type is cached
 * per entity for the lifetime of this object, and a {@link Types#lazy lazy}
 * placeholder stands in for it while it is being built.
 * Use a fresh instance for each derivation.
 */
final class RetrieveTypeDeriver {
	static final Type SORT_DIRECTION = Types.enumeration(List.of("asc", "desc"), BasicOptions.named("SortDirection"));

	private final int takeMax;
	private final Map<ConcreteType, Type> selects = new IdentityHashMap<>();
	private final Map<ConcreteType, Type> wheres = new IdentityHashMap<>();
	private final Map<ConcreteType, Type> orderBys = new IdentityHashMap<>();
	private final Map<ConcreteType, Type> fullRetrieves = new IdentityHashMap<>();

	RetrieveTypeDeriver(int takeMax) {
		this.takeMax = takeMax;
	}

	/**
	 * Thrown when part of an entity has a shape that can't be queried.
	 */
	static final class UnsupportedShapeException extends RuntimeException {
		UnsupportedShapeException(String message) {
			super(message);
		}
	}

	ObjectType retrieve(EntityType entity, RetrieveCapabilities capabilities) {
		Map<String, Type> fields = new LinkedHashMap<>();
		if (capabilities.where()) {
			fields.put("where", optional(entityWhere(entity)));
		}
		if (capabilities.select()) {
			fields.put("select", optional(entitySelect(entity)));
		}
		if (capabilities.orderBy()) {
			fields.put("orderBy", optional(array(entityOrderBy(entity))));
		}
		if (capabilities.skip()) {
			fields.put("skip", optional(integer(NumberOptions.builder().minimum(0.0).build())));
		}
		if (capabilities.take()) {
			fields.put("take", optional(integer(NumberOptions.builder().minimum(0.0).maximum((double) takeMax).build())));
		}
		return object(fields, derivedOptions(entity, "Retrieve"));
	}

	/**
	 * The retrieve type for a to-many relation, which supports every capability.
	 */
	private Type fullRetrieve(EntityType entity) {
		return memoized(fullRetrieves, entity, () -> retrieve(entity, RetrieveCapabilities.ALL.withTakeMax(takeMax)));
	}

	// Select

	Type entitySelect(EntityType entity) {
		return memoized(selects, entity, () -> object(fieldSelects(entity.fields()), derivedOptions(entity, "Select")));
	}

	private Map<String, Type> fieldSelects(Map<String, Type> fields) {
		Map<String, Type> result = new LinkedHashMap<>();
		fields.forEach((name, fieldType) -> result.put(name, optional(select(fieldType))));
		return result;
	}

	private Type select(Type fieldType) {
		ConcreteType concrete = Types.unwrapField(fieldType);
		return switch (concrete.kind()) {
			case ARRAY -> {
				ConcreteType element = Types.unwrapField(((ArrayType) concrete).wrappedType());
				if (element.kind() == Kind.ARRAY) {
					throw new UnsupportedShapeException("Array of array not supported in selection");
				} else if (element.kind() == Kind.ENTITY) {
					yield union(members()
						.with("retrieve", fullRetrieve((EntityType) element))
						.with("all", bool()));
				} else {
					yield select(element);
				}
			}
			case ENTITY -> union(members()
				.with("retrieve", object(members().with("select", optional(entitySelect((EntityType) concrete)))))
				.with("all", bool()));
			case OBJECT -> union(members()
				.with("fields", object(members().with("select", optional(objectSelect((ObjectType) concrete)))))
				.with("all", bool()));
			default -> bool();
		};
	}

	private Type objectSelect(ObjectType type) {
		return memoized(selects, type, () -> object(fieldSelects(type.fields()), BasicOptions.NONE));
	}

	// Where

	Type entityWhere(EntityType entity) {
		return memoized(wheres, entity, () -> {
			Type self = wheres.get(entity);
			Map<String, Type> fields = new LinkedHashMap<>();
			entity.fields().forEach((name, fieldType) -> {
				Type fieldWhere = where(fieldType);
				if (fieldWhere != null) {
					fields.put(name, optional(fieldWhere));
				}
			});
			for (String combinator: List.of("AND", "OR", "NOT")) {
				if (fields.containsKey(combinator)) {
					throw new UnsupportedShapeException("Field \"" + combinator + "\" of " + entity.displayName() + " clashes with the where combinator");
				}
			}
			fields.put("AND", optional(array(self)));
			fields.put("OR", optional(array(self)));
			fields.put("NOT", optional(self));
			return object(fields, derivedOptions(entity, "Where"));
		});
	}

	/**
	 * @return null if the field can't be filtered on
	 */
	private @Nullable Type where(Type fieldType) {
		ConcreteType concrete = Types.unwrapField(fieldType);
		return switch (concrete.kind()) {
			case ARRAY -> {
				Type elementType = ((ArrayType) concrete).wrappedType();
				ConcreteType element = Types.unwrapField(elementType);
				if (element.kind() == Kind.ARRAY) {
					throw new UnsupportedShapeException("Array of array not supported in where");
				} else if (element.kind() == Kind.ENTITY) {
					Type elementWhere = entityWhere((EntityType) element);
					yield object(members()
						.with("some", optional(elementWhere))
						.with("every", optional(elementWhere))
						.with("none", optional(elementWhere)));
				} else if (element.kind() == Kind.UNION) {
					yield null;
				} else {
					yield object(members()
						.with("equals", optional(array(elementType)))
						.with("isEmpty", optional(bool())));
				}
			}
			case ENTITY -> entityWhere((EntityType) concrete);
			case OBJECT -> object(members().with("equals", optional(concrete)));
			case UNION -> null;
			case NUMBER -> object(members()
				.with("equals", optional(concrete))
				.with("in", optional(array(concrete)))
				.with("lt", optional(concrete))
				.with("lte", optional(concrete))
				.with("gt", optional(concrete))
				.with("gte", optional(concrete)));
			default -> object(members()
				.with("equals", optional(concrete))
				.with("in", optional(array(concrete))));
		};
	}

	// Order by

	Type entityOrderBy(EntityType entity) {
		return memoized(orderBys, entity, () -> object(fieldOrderBys(entity.fields()), derivedOptions(entity, "OrderBy")));
	}

	private Map<String, Type> fieldOrderBys(Map<String, Type> fields) {
		Map<String, Type> result = new LinkedHashMap<>();
		fields.forEach((name, fieldType) -> {
			Type fieldOrderBy = orderBy(fieldType);
			if (fieldOrderBy != null) {
				result.put(name, optional(fieldOrderBy));
			}
		});
		return result;
	}

	/**
	 * @return null if the field can't be sorted on
	 */
	private @Nullable Type orderBy(Type fieldType) {
		ConcreteType concrete = Types.unwrapField(fieldType);
		return switch (concrete.kind()) {
			case ARRAY -> {
				if (Types.unwrapField(((ArrayType) concrete).wrappedType()).kind() == Kind.ARRAY) {
					throw new UnsupportedShapeException("Array of array not supported in orderBy");
				}
				yield object(members().with("_count", optional(SORT_DIRECTION)));
			}
			case ENTITY -> entityOrderBy((EntityType) concrete);
			case OBJECT -> memoized(orderBys, concrete, () -> object(fieldOrderBys(((ObjectType) concrete).fields()), BasicOptions.NONE));
			case UNION -> null;
			default -> SORT_DIRECTION;
		};
	}

	// Helpers

	/**
	 * While {@code builder} runs, the cache holds a lazy placeholder,
	 * so a cyclic reference back to {@code key} finds the placeholder instead of recursing.
	 */
	private static Type memoized(Map<ConcreteType, Type> cache, ConcreteType key, Supplier<Type> builder) {
		Type cached = cache.get(key);
		if (cached != null) {
			return cached;
		}
		Type[] built = new Type[1];
		cache.put(key, Types.lazy(() -> built[0]));
		built[0] = builder.get();
		LOGGER.trace("Derived {} from {}", built[0], key);
		return built[0];
	}

	private static BasicOptions derivedOptions(EntityType entity, String suffix) {
		String name = entity.options().name();
		return name == null ? BasicOptions.NONE : BasicOptions.named(name + suffix);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RetrieveTypeDeriver.class);
}
