package works.strata.types;

import java.util.HashSet;
import java.util.List;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * A type whose values are the given strings.
 */
public record EnumType(List<String> variants, BasicOptions options) implements ConcreteType {
	public EnumType {
		requireNonNull(options);
		variants = List.copyOf(variants);
		if (variants.isEmpty()) {
			throw new InvalidTypeException("Enum must have at least one variant");
		}
		if (new HashSet<>(variants).size() != variants.size()) {
			throw new InvalidTypeException("Enum variants must be distinct: " + variants);
		}
	}

	@Override
	public Kind kind() {
		return Kind.ENUM;
	}
}
