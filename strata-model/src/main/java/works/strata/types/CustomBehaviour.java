package works.strata.types;

import java.util.List;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;

/**
 * Supplies the behaviour of a {@link CustomType}.
 * <p>
 * Errors returned from these methods carry paths relative to the custom value itself;
 * the caller prefixes them with the location of that value.
 *
 * @param <O> the type of the custom options
 */
public interface CustomBehaviour<O> {
	Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, O customOptions);

	/**
	 * @param value has already been decoded by {@link #decode}
	 * @return a wire value: null, a {@link String}, {@link Number}, {@link Boolean},
	 * {@link List}, or {@link java.util.Map}
	 */
	Object encode(Object value, EncodingOptions options, O customOptions);

	Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, O customOptions);

	Arbitrary arbitrary(int maxDepth, O customOptions);
}
