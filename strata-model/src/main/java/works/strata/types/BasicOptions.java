package works.strata.types;

import lombok.Builder;
import lombok.With;
import org.jetbrains.annotations.Nullable;

@With
@Builder(toBuilder = true)
public record BasicOptions(
	@Nullable String name,
	@Nullable String description,
	boolean sensitive
) implements TypeOptions {
	public static final BasicOptions NONE = new BasicOptions(null, null, false);

	public static BasicOptions named(String name) {
		return NONE.withName(name);
	}
}
