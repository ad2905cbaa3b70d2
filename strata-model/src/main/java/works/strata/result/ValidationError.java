package works.strata.result;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.strata.path.Path;

import static java.util.Objects.requireNonNull;

/**
 * A well-shaped value breaks one of its type's constraints.
 *
 * @param assertion the constraint that failed, like {@code "string longer than max length (5)"}
 */
public record ValidationError(Path path, String assertion, @Nullable Object got) implements ValueError {
	public ValidationError {
		requireNonNull(path);
		requireNonNull(assertion);
	}

	public static List<ValidationError> of(String assertion, Object got) {
		return List.of(new ValidationError(Path.root(), assertion, got));
	}

	@Override
	public String description() {
		return assertion;
	}

	public ValidationError withPath(Path newPath) {
		return new ValidationError(newPath, assertion, got);
	}

	public static List<ValidationError> prependField(List<ValidationError> errors, String name) {
		return errors.stream().map(e -> e.withPath(e.path.prependField(name))).toList();
	}

	public static List<ValidationError> prependIndex(List<ValidationError> errors, int index) {
		return errors.stream().map(e -> e.withPath(e.path.prependIndex(index))).toList();
	}

	public static List<ValidationError> prependVariant(List<ValidationError> errors, String name) {
		return errors.stream().map(e -> e.withPath(e.path.prependVariant(name))).toList();
	}
}
