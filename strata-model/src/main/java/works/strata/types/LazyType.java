package works.strata.types;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import works.strata.exceptions.TypeGraphException;

import static java.util.Objects.requireNonNull;

/**
 * An indirection that allows types to refer to themselves.
 * <pre>
 * static final Type USER = lazy(() -> entity(members()
 *     .with("name", string())
 *     .with("bestFriend", optional(Fixtures.USER))));
 * </pre>
 * <p>
 * The producer is called at most once per {@code LazyType} instance,
 * so every resolution of the same instance yields the identical concrete type.
 * Algorithms that need cycle detection rely on this identity.
 */
public final class LazyType implements Type {
	private static final AtomicLong NEXT_ID = new AtomicLong(1);

	private final long id;
	private final Supplier<? extends Type> producer;
	private volatile ConcreteType resolved;
	private boolean resolving;

	LazyType(Supplier<? extends Type> producer) {
		this.id = NEXT_ID.getAndIncrement();
		this.producer = requireNonNull(producer);
	}

	public long id() {
		return id;
	}

	/**
	 * Follows lazy indirections until reaching a concrete type.
	 *
	 * @throws TypeGraphException if the producer returns null, or resolves to itself without
	 * passing through a concrete type
	 */
	public ConcreteType concretise() {
		ConcreteType result = resolved;
		if (result != null) {
			return result;
		}
		synchronized (this) {
			if (resolved == null) {
				if (resolving) {
					throw new TypeGraphException("Lazy type #" + id + " refers to itself without an intervening concrete type");
				}
				resolving = true;
				try {
					Type produced = producer.get();
					if (produced == null) {
						throw new TypeGraphException("Lazy type #" + id + " produced null");
					}
					resolved = (produced instanceof LazyType lazy) ? lazy.concretise() : (ConcreteType) produced;
				} finally {
					resolving = false;
				}
			}
			return resolved;
		}
	}

	@Override
	public String toString() {
		return "Lazy#" + id;
	}
}
