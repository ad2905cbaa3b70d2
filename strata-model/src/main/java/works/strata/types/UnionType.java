package works.strata.types;

import java.util.Map;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * A value of exactly one of the named variants.
 * On the wire, it's a single-key object <code>{variantName: value}</code>.
 *
 * @param variants in declaration order, which is also the order in which
 *                 variants are tried when resolving a value
 */
public record UnionType(Map<String, Type> variants, BasicOptions options) implements ConcreteType {
	public UnionType {
		variants = Members.checkedCopy(variants, "variant");
		requireNonNull(options);
		if (variants.isEmpty()) {
			throw new InvalidTypeException("Union must have at least one variant");
		}
	}

	@Override
	public Kind kind() {
		return Kind.UNION;
	}

	@Override
	public String toString() {
		return "UnionType[" + displayName() + variants.keySet() + "]";
	}
}
