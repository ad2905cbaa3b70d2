package works.strata.result;

import java.util.NoSuchElementException;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of an operation that can fail on bad input:
 * either {@link Ok} with a value, or {@link Failure} with an error.
 * <p>
 * An {@link Ok} value may be null, since null is a legitimate typed value.
 * A {@link Failure} error may not.
 */
public sealed interface Result<T, E> {

	record Ok<T, E>(T value) implements Result<T, E> { }

	record Failure<T, E>(E error) implements Result<T, E> {
		public Failure {
			requireNonNull(error);
		}
	}

	static <T, E> Result<T, E> ok(T value) {
		return new Ok<>(value);
	}

	static <T, E> Result<T, E> failure(E error) {
		return new Failure<>(error);
	}

	default boolean isOk() {
		return this instanceof Ok;
	}

	default boolean isFailure() {
		return this instanceof Failure;
	}

	/**
	 * @throws NoSuchElementException if this is a {@link Failure}
	 */
	default T value() {
		if (this instanceof Ok<T, E> ok) {
			return ok.value();
		} else {
			throw new NoSuchElementException("Result is a failure: " + error());
		}
	}

	/**
	 * @throws NoSuchElementException if this is an {@link Ok}
	 */
	default E error() {
		if (this instanceof Failure<T, E> failure) {
			return failure.error();
		} else {
			throw new NoSuchElementException("Result is ok");
		}
	}

	default <U> Result<U, E> map(Function<? super T, ? extends U> f) {
		if (this instanceof Ok<T, E> ok) {
			return ok(f.apply(ok.value()));
		} else {
			return failure(error());
		}
	}

	default <F> Result<T, F> mapError(Function<? super E, ? extends F> f) {
		if (this instanceof Failure<T, E> failure) {
			return failure(f.apply(failure.error()));
		} else {
			return ok(value());
		}
	}

	default <U> Result<U, E> chain(Function<? super T, Result<U, E>> f) {
		if (this instanceof Ok<T, E> ok) {
			return f.apply(ok.value());
		} else {
			return failure(error());
		}
	}

	default T orElse(T other) {
		return isOk() ? value() : other;
	}

	default <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionFactory) {
		if (this instanceof Ok<T, E> ok) {
			return ok.value();
		} else {
			throw exceptionFactory.apply(error());
		}
	}
}
