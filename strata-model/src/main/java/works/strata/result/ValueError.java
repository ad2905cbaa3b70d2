package works.strata.result;

import java.util.List;
import works.strata.path.Path;

/**
 * Something wrong with a value, located by a {@link Path} relative to the root of that value.
 */
public sealed interface ValueError permits DecodingError, ValidationError {
	Path path();

	/**
	 * What the value should have been.
	 */
	String description();

	/**
	 * The offending value.
	 */
	Object got();

	/**
	 * Suitable for log messages and exception text.
	 */
	static String describe(List<? extends ValueError> errors) {
		StringBuilder sb = new StringBuilder();
		for (ValueError e: errors) {
			if (!sb.isEmpty()) {
				sb.append("; ");
			}
			sb.append(e.path()).append(": expected ").append(e.description()).append(", got ").append(e.got());
		}
		return sb.toString();
	}
}
