package works.strata.types;

import static java.util.Objects.requireNonNull;

public record NullableType(Type wrappedType, BasicOptions options) implements WrapperType {
	public NullableType {
		requireNonNull(wrappedType);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.NULLABLE;
	}
}
