package works.strata.types;

import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * A type whose behaviour is supplied by a {@link CustomBehaviour}.
 *
 * @param typeName identifies the custom type, like {@code "datetime"}
 * @param customOptions passed to every callback of {@code behaviour}
 */
public record CustomType<O>(
	String typeName,
	CustomBehaviour<O> behaviour,
	@Nullable O customOptions,
	BasicOptions options
) implements ConcreteType {
	public CustomType {
		requireNonNull(typeName);
		requireNonNull(behaviour);
		requireNonNull(options);
		if (typeName.isBlank()) {
			throw new InvalidTypeException("Custom type name must not be blank");
		}
	}

	@Override
	public Kind kind() {
		return Kind.CUSTOM;
	}

	@Override
	public String displayName() {
		String name = options.name();
		return name == null ? typeName : name;
	}
}
