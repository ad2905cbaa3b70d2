package works.strata.types;

import java.util.Objects;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

/**
 * @param regex must match the entire string
 */
@With
@Builder(toBuilder = true)
public record StringOptions(
	@Nullable String name,
	@Nullable String description,
	boolean sensitive,
	@Nullable Integer minLength,
	@Nullable Integer maxLength,
	@Nullable Pattern regex
) implements TypeOptions {
	public static final StringOptions NONE = new StringOptions(null, null, false, null, null, null);

	public StringOptions {
		if (minLength != null && minLength < 0) {
			throw new InvalidTypeException("String minLength must be non-negative: " + minLength);
		}
		if (maxLength != null && maxLength < 0) {
			throw new InvalidTypeException("String maxLength must be non-negative: " + maxLength);
		}
		if (minLength != null && maxLength != null && minLength > maxLength) {
			throw new InvalidTypeException("String minLength (" + minLength + ") must be less than or equal to maxLength (" + maxLength + ")");
		}
	}

	// Pattern has identity equality

	@Override
	public boolean equals(Object obj) {
		return obj instanceof StringOptions other
			&& sensitive == other.sensitive
			&& Objects.equals(name, other.name)
			&& Objects.equals(description, other.description)
			&& Objects.equals(minLength, other.minLength)
			&& Objects.equals(maxLength, other.maxLength)
			&& Objects.equals(regexSource(), other.regexSource());
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, description, sensitive, minLength, maxLength, regexSource());
	}

	private String regexSource() {
		return regex == null ? null : regex.pattern() + "/" + regex.flags();
	}
}
