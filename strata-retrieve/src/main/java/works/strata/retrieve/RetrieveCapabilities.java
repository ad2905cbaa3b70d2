package works.strata.retrieve;

import lombok.With;
import works.strata.exceptions.InvalidTypeException;

/**
 * Which parts of a retrieve shape to derive.
 *
 * @param takeMax the largest {@code take} a caller may ask for
 */
@With
public record RetrieveCapabilities(
	boolean select,
	boolean where,
	boolean orderBy,
	boolean skip,
	boolean take,
	int takeMax
) {
	public static final int DEFAULT_TAKE_MAX = 20;

	public static final RetrieveCapabilities NONE = new RetrieveCapabilities(false, false, false, false, false, DEFAULT_TAKE_MAX);
	public static final RetrieveCapabilities ALL = new RetrieveCapabilities(true, true, true, true, true, DEFAULT_TAKE_MAX);
	public static final RetrieveCapabilities SELECT_ONLY = NONE.withSelect(true);

	public RetrieveCapabilities {
		if (takeMax < 0) {
			throw new InvalidTypeException("takeMax must be non-negative: " + takeMax);
		}
	}

	public boolean isEmpty() {
		return !(select || where || orderBy || skip || take);
	}
}
