package works.strata.types;

/**
 * A type is a first-class value describing the shape of some data.
 * <p>
 * A {@code Type} is either a {@link ConcreteType}, whose {@link Kind} tells how to
 * interpret it, or a {@link LazyType}, which stands in for a concrete type that
 * can't be built yet because it refers to itself, directly or indirectly.
 * Use {@link Types#concretise} to get from one to the other.
 * <p>
 * Types are immutable once constructed, and may be shared freely between threads.
 */
public sealed interface Type permits ConcreteType, LazyType {
}
