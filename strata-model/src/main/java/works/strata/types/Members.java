package works.strata.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Builds the ordered name-to-type maps used for object fields and union variants.
 * <pre>
 * object(members()
 *     .with("name", string())
 *     .with("age", optional(integer())))
 * </pre>
 */
public final class Members {
	private final LinkedHashMap<String, Type> map = new LinkedHashMap<>();

	Members() { }

	public Members with(String name, Type type) {
		if (map.putIfAbsent(requireNonNull(name), requireNonNull(type)) != null) {
			throw new InvalidTypeException("Duplicate member name \"" + name + "\"");
		}
		return this;
	}

	public Map<String, Type> toMap() {
		return checkedCopy(map, "member");
	}

	static Map<String, Type> checkedCopy(Map<String, ? extends Type> members, String description) {
		LinkedHashMap<String, Type> result = new LinkedHashMap<>();
		members.forEach((name, type) -> {
			requireNonNull(name, description + " name");
			requireNonNull(type, () -> description + " type for " + name);
			if (name.isBlank()) {
				throw new InvalidTypeException("The " + description + " name must not be blank");
			}
			if (name.startsWith("$")) {
				throw new InvalidTypeException("The " + description + " name \"" + name + "\" must not start with '$'");
			}
			result.put(name, type);
		});
		return Collections.unmodifiableMap(result);
	}
}
