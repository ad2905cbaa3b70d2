package works.strata.arbitrary;

import java.util.List;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import works.strata.exceptions.ArbitraryGenerationException;

import static java.util.Objects.requireNonNull;

/**
 * A source of random values.
 * <p>
 * All randomness comes from the supplied {@link Random},
 * so the same seed always produces the same values.
 */
@FunctionalInterface
public interface Arbitrary {
	Object generate(Random random);

	/**
	 * @return a lazy, infinite stream; calling this again with the same seed
	 * yields the same stream
	 */
	default Stream<Object> samples(long seed) {
		Random random = new Random(seed);
		return Stream.generate(() -> generate(random));
	}

	default List<Object> sample(long seed, int count) {
		return samples(seed).limit(count).toList();
	}

	default Arbitrary map(Function<Object, Object> f) {
		requireNonNull(f);
		return random -> f.apply(generate(random));
	}

	/**
	 * @throws ArbitraryGenerationException from {@link #generate} if
	 * {@code maxAttempts} values in a row fail the predicate
	 */
	default Arbitrary filter(Predicate<Object> predicate, int maxAttempts) {
		requireNonNull(predicate);
		return random -> {
			for (int i = 0; i < maxAttempts; i++) {
				Object candidate = generate(random);
				if (predicate.test(candidate)) {
					return candidate;
				}
			}
			throw new ArbitraryGenerationException("No value satisfied the filter after " + maxAttempts + " attempts");
		};
	}

	static Arbitrary constant(Object value) {
		return random -> value;
	}

	static Arbitrary oneOf(List<?> values) {
		List<?> copy = List.copyOf(values);
		if (copy.isEmpty()) {
			throw new IllegalArgumentException("Nothing to choose from");
		}
		return random -> copy.get(random.nextInt(copy.size()));
	}

	static Arbitrary integer(long min, long max) {
		if (min > max) {
			throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
		}
		return random -> {
			long span = max - min + 1;
			if (span <= 0) {
				// Range covers more than half of all longs
				long result;
				do {
					result = random.nextLong();
				} while (result < min || result > max);
				return result;
			} else {
				return min + Math.floorMod(random.nextLong(), span);
			}
		};
	}
}
