package works.strata.types;

import static java.util.Objects.requireNonNull;

public record ArrayType(Type wrappedType, Mutability mutability, ArrayOptions options) implements WrapperType {
	public ArrayType {
		requireNonNull(wrappedType);
		requireNonNull(mutability);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.ARRAY;
	}
}
