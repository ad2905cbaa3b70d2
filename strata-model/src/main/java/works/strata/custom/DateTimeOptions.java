package works.strata.custom;

import java.time.Instant;
import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

@With
@Builder(toBuilder = true)
public record DateTimeOptions(
	@Nullable Instant minimum,
	@Nullable Instant maximum
) {
	public static final DateTimeOptions NONE = new DateTimeOptions(null, null);

	public DateTimeOptions {
		if (minimum != null && maximum != null && minimum.isAfter(maximum)) {
			throw new InvalidTypeException("Minimum " + minimum + " is after maximum " + maximum);
		}
	}
}
