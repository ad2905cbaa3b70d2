package works.strata.types;

import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.strata.exceptions.InvalidTypeException;

@With
@Builder(toBuilder = true)
public record ArrayOptions(
	@Nullable String name,
	@Nullable String description,
	boolean sensitive,
	@Nullable Integer minItems,
	@Nullable Integer maxItems
) implements TypeOptions {
	public static final ArrayOptions NONE = new ArrayOptions(null, null, false, null, null);

	public ArrayOptions {
		if (minItems != null && minItems < 0) {
			throw new InvalidTypeException("Array minItems must be non-negative: " + minItems);
		}
		if (maxItems != null && maxItems < 0) {
			throw new InvalidTypeException("Array maxItems must be non-negative: " + maxItems);
		}
		if (minItems != null && maxItems != null && minItems > maxItems) {
			throw new InvalidTypeException("Array minItems (" + minItems + ") must be less than or equal to maxItems (" + maxItems + ")");
		}
	}
}
