package works.strata.types;

import static java.util.Objects.requireNonNull;

/**
 * Marks a field as pointing at a record that lives elsewhere, like a foreign key.
 * Decoding, validation and encoding pass straight through to the wrapped type.
 */
public record ReferenceType(Type wrappedType, BasicOptions options) implements WrapperType {
	public ReferenceType {
		requireNonNull(wrappedType);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.REFERENCE;
	}
}
