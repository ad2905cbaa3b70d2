package works.strata.retrieve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.strata.retrieve.MergeOptions.Order;
import works.strata.types.ConcreteType;
import works.strata.types.EntityType;
import works.strata.types.Kind;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.WrapperType;

import static java.util.Objects.requireNonNull;

final class RetrieveMerger {
	private final MergeOptions options;

	RetrieveMerger(MergeOptions options) {
		this.options = requireNonNull(options);
	}

	@Nullable Map<String, Object> merge(Type type, @Nullable Map<String, ?> left, @Nullable Map<String, ?> right) {
		if (left == null) {
			return copy(right);
		}
		if (right == null) {
			return copy(left);
		}
		Map<String, Object> result = new LinkedHashMap<>();

		Object leftWhere = whereFilter(left.get("where"));
		Object rightWhere = whereFilter(right.get("where"));
		if (leftWhere != null && rightWhere != null) {
			result.put("where", Map.of("AND", List.of(leftWhere, rightWhere)));
		} else {
			putIfPresent(result, "where", leftWhere != null ? leftWhere : rightWhere);
		}

		Object select = mergeSelect(type, left.get("select"), right.get("select"));
		putIfPresent(result, "select", select);

		List<Object> leftOrderBy = orderByList(left.get("orderBy"));
		List<Object> rightOrderBy = orderByList(right.get("orderBy"));
		List<Object> orderBy = new ArrayList<>();
		if (options.orderByOrder() == Order.RIGHT_BEFORE) {
			orderBy.addAll(rightOrderBy);
			orderBy.addAll(leftOrderBy);
		} else {
			orderBy.addAll(leftOrderBy);
			orderBy.addAll(rightOrderBy);
		}
		if (!orderBy.isEmpty()) {
			result.put("orderBy", Collections.unmodifiableList(orderBy));
		}

		putIfPresent(result, "skip", firstPresent(options.skipOrder(), left.get("skip"), right.get("skip")));
		putIfPresent(result, "take", firstPresent(options.takeOrder(), left.get("take"), right.get("take")));
		return Collections.unmodifiableMap(result);
	}

	private @Nullable Object mergeSelect(Type type, @Nullable Object left, @Nullable Object right) {
		if (left == null) {
			return right;
		}
		if (right == null) {
			return left;
		}
		ConcreteType concrete = Types.concretise(type);
		if (concrete instanceof WrapperType wrapper) {
			return mergeSelect(wrapper.wrappedType(), left, right);
		}
		if (concrete.kind() != Kind.ENTITY || !(left instanceof Map<?, ?> leftMap) || !(right instanceof Map<?, ?> rightMap)) {
			return left;
		}

		Map<String, Object> result = new LinkedHashMap<>();
		((EntityType) concrete).fields().forEach((name, fieldType) -> {
			Object leftSelect = leftMap.get(name);
			Object rightSelect = rightMap.get(name);
			if (!isSelected(leftSelect)) {
				putIfPresent(result, name, rightSelect);
			} else if (!isSelected(rightSelect)) {
				putIfPresent(result, name, leftSelect);
			} else {
				result.put(name, mergeField(fieldType, leftSelect, rightSelect));
			}
		});
		return Collections.unmodifiableMap(result);
	}

	/**
	 * Both sides select the field.
	 */
	private Object mergeField(Type fieldType, Object leftSelect, Object rightSelect) {
		ConcreteType unwrapped = Types.unwrap(fieldType);
		boolean leftAll = Boolean.TRUE.equals(leftSelect);
		boolean rightAll = Boolean.TRUE.equals(rightSelect);
		if (unwrapped.kind() == Kind.ENTITY) {
			EntityType entity = (EntityType) unwrapped;
			if (leftAll && rightAll) {
				return true;
			}
			Map<String, ?> left = leftAll ? selectAll(entity) : asMap(leftSelect);
			Map<String, ?> right = rightAll ? selectAll(entity) : asMap(rightSelect);
			return merge(entity, left, right);
		} else if (leftAll || rightAll) {
			return true;
		} else {
			Object select = deepMerge(asMap(rightSelect).get("select"), asMap(leftSelect).get("select"));
			return select == null ? Map.of() : Map.of("select", select);
		}
	}

	/**
	 * The retrieve equivalent to selecting a relation with {@code true}:
	 * every field except further relations.
	 */
	private static Map<String, ?> selectAll(EntityType entity) {
		Map<String, Object> select = new LinkedHashMap<>();
		entity.fields().forEach((name, fieldType) -> {
			if (Types.unwrap(fieldType).kind() != Kind.ENTITY) {
				select.put(name, true);
			}
		});
		return Map.of("select", select);
	}

	/**
	 * Values from {@code preferred} win where both sides have a non-map value.
	 */
	private static @Nullable Object deepMerge(@Nullable Object other, @Nullable Object preferred) {
		if (other instanceof Map<?, ?> otherMap && preferred instanceof Map<?, ?> preferredMap) {
			Map<String, Object> result = new LinkedHashMap<>();
			otherMap.forEach((k, v) -> result.put(String.valueOf(k), v));
			preferredMap.forEach((k, v) -> {
				if (v != null) {
					result.merge(String.valueOf(k), v, RetrieveMerger::deepMerge);
				}
			});
			return Collections.unmodifiableMap(result);
		}
		return preferred != null ? preferred : other;
	}

	/**
	 * An empty where map filters nothing, so it counts as absent.
	 */
	private static @Nullable Object whereFilter(@Nullable Object where) {
		return (where instanceof Map<?, ?> map && map.isEmpty()) ? null : where;
	}

	static boolean isSelected(@Nullable Object select) {
		return select != null && !Boolean.FALSE.equals(select);
	}

	private static @Nullable Object firstPresent(Order order, @Nullable Object left, @Nullable Object right) {
		if (order == Order.RIGHT_BEFORE) {
			return right != null ? right : left;
		} else {
			return left != null ? left : right;
		}
	}

	/**
	 * A single orderBy map is treated as a list of one.
	 */
	private static List<Object> orderByList(@Nullable Object orderBy) {
		if (orderBy == null) {
			return List.of();
		} else if (orderBy instanceof List<?> list) {
			return new ArrayList<>(list);
		} else {
			return List.of(orderBy);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> asMap(Object value) {
		if (value instanceof Map<?, ?>) {
			return (Map<String, ?>) value;
		}
		throw new IllegalArgumentException("Expected a retrieve map; got " + value);
	}

	private static void putIfPresent(Map<String, Object> map, String key, @Nullable Object value) {
		if (value != null) {
			map.put(key, value);
		}
	}

	private static @Nullable Map<String, Object> copy(@Nullable Map<String, ?> retrieve) {
		return retrieve == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(retrieve));
	}
}
