package works.strata.types;

import static java.util.Objects.requireNonNull;

/**
 * A value that may be absent.
 * Inside an object, an absent value is an omitted key;
 * elsewhere it is represented as null.
 *
 * @see works.strata.types.Absent
 */
public record OptionalType(Type wrappedType, BasicOptions options) implements WrapperType {
	public OptionalType {
		requireNonNull(wrappedType);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.OPTIONAL;
	}
}
