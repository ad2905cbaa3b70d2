package works.strata.options;

import lombok.Builder;
import lombok.With;

import static java.util.Objects.requireNonNull;

@With
@Builder(toBuilder = true)
public record EncodingOptions(
	SensitiveInformationStrategy sensitiveInformationStrategy
) {
	public static final EncodingOptions DEFAULT = new EncodingOptions(SensitiveInformationStrategy.KEEP);

	public EncodingOptions {
		requireNonNull(sensitiveInformationStrategy);
	}

	public enum SensitiveInformationStrategy {
		KEEP,

		/**
		 * Values of {@link works.strata.types.TypeOptions#sensitive() sensitive} types encode as null.
		 */
		HIDE,
	}
}
