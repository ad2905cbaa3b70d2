package works.strata.types;

import static java.util.Objects.requireNonNull;

public record BooleanType(BasicOptions options) implements ConcreteType {
	public BooleanType {
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.BOOLEAN;
	}
}
