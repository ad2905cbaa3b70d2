package works.strata.types;

import org.jetbrains.annotations.Nullable;

/**
 * Options shared by all kinds.
 * <p>
 * A {@link #sensitive()} type holds information that can be hidden at encoding time
 * using {@link works.strata.options.EncodingOptions.SensitiveInformationStrategy#HIDE HIDE}.
 */
public sealed interface TypeOptions permits BasicOptions, StringOptions, NumberOptions, ArrayOptions {
	@Nullable String name();
	@Nullable String description();
	boolean sensitive();
}
