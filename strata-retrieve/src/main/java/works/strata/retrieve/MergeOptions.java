package works.strata.retrieve;

import lombok.Builder;
import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * Decides which side of a {@link Retrieve#merge merge} comes first
 * wherever the two sides compete.
 */
@With
@Builder(toBuilder = true)
public record MergeOptions(
	Order orderByOrder,
	Order skipOrder,
	Order takeOrder
) {
	public enum Order {
		LEFT_BEFORE,
		RIGHT_BEFORE,
	}

	public static final MergeOptions DEFAULT = of(Order.LEFT_BEFORE);

	public MergeOptions {
		requireNonNull(orderByOrder);
		requireNonNull(skipOrder);
		requireNonNull(takeOrder);
	}

	public static MergeOptions of(Order order) {
		return new MergeOptions(order, order, order);
	}
}
