package works.strata.types;

import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * A type with exactly one value.
 *
 * @param value a {@link String}, {@link Long}, {@link Double}, {@link Boolean}, or null
 */
public record LiteralType(@Nullable Object value, BasicOptions options) implements ConcreteType {
	public LiteralType {
		requireNonNull(options);
		if (value != null && !(value instanceof String || value instanceof Long || value instanceof Double || value instanceof Boolean)) {
			throw new InvalidTypeException("Literal value must be a string, long, double, boolean, or null; got " + value.getClass().getSimpleName());
		}
		if (value instanceof Double d && !Double.isFinite(d)) {
			throw new InvalidTypeException("Literal number must be finite: " + d);
		}
	}

	@Override
	public Kind kind() {
		return Kind.LITERAL;
	}
}
