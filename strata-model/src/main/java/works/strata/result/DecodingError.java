package works.strata.result;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.strata.path.Path;

import static java.util.Objects.requireNonNull;

/**
 * The raw input doesn't have the shape the type calls for.
 *
 * @param expected describes the acceptable input, like {@code "string"} or {@code "array"}
 * @param got the offending input, which may be {@link works.strata.types.Absent#VALUE absent}
 */
public record DecodingError(Path path, String expected, @Nullable Object got) implements ValueError {
	public DecodingError {
		requireNonNull(path);
		requireNonNull(expected);
	}

	public static List<DecodingError> of(String expected, Object got) {
		return List.of(new DecodingError(Path.root(), expected, got));
	}

	@Override
	public String description() {
		return expected;
	}

	public DecodingError withPath(Path newPath) {
		return new DecodingError(newPath, expected, got);
	}

	public DecodingError withExpected(String newExpected) {
		return new DecodingError(path, newExpected, got);
	}

	public static List<DecodingError> prependField(List<DecodingError> errors, String name) {
		return errors.stream().map(e -> e.withPath(e.path.prependField(name))).toList();
	}

	public static List<DecodingError> prependIndex(List<DecodingError> errors, int index) {
		return errors.stream().map(e -> e.withPath(e.path.prependIndex(index))).toList();
	}

	public static List<DecodingError> prependVariant(List<DecodingError> errors, String name) {
		return errors.stream().map(e -> e.withPath(e.path.prependVariant(name))).toList();
	}
}
