package works.strata.types;

import static java.util.Objects.requireNonNull;

/**
 * Integers decode to {@link Long}; other numbers decode to {@link Double}
 * unless they are integral, in which case they also decode to {@link Long}.
 */
public record NumberType(NumberOptions options) implements ConcreteType {
	public NumberType {
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.NUMBER;
	}

	public boolean isInteger() {
		return options.isInteger();
	}
}
