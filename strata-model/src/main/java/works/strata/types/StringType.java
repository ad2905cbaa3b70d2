package works.strata.types;

import static java.util.Objects.requireNonNull;

public record StringType(StringOptions options) implements ConcreteType {
	public StringType {
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.STRING;
	}
}
