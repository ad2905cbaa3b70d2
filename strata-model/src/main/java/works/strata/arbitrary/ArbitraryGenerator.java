package works.strata.arbitrary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.exceptions.ArbitraryGenerationException;
import works.strata.types.Absent;
import works.strata.types.ArrayType;
import works.strata.types.ConcreteType;
import works.strata.types.CustomType;
import works.strata.types.EnumType;
import works.strata.types.FieldsType;
import works.strata.types.LiteralType;
import works.strata.types.Mutability;
import works.strata.types.NumberOptions;
import works.strata.types.NumberType;
import works.strata.types.StringOptions;
import works.strata.types.StringType;
import works.strata.types.Type;
import works.strata.types.Types;
import works.strata.types.UnionType;
import works.strata.types.WrapperType;

/**
 * Generates random values of a {@link Type} that pass validation.
 * <p>
 * Each recursive step lowers the depth budget by one. Once it reaches zero,
 * arrays are as short as allowed, optionals are absent, nullables are null
 * and unions pick a variant that doesn't lead back to themselves,
 * which ends the recursion unless a required field or a minimum item count
 * forces it to continue.
 */
public final class ArbitraryGenerator {
	public static final int DEFAULT_MAX_DEPTH = 3;

	/**
	 * How far below zero the depth budget may fall before we conclude
	 * that the type has no finite values.
	 */
	static final int RECURSION_LIMIT = -100;

	static final int DEFAULT_EXTRA_LENGTH = 16;
	static final int DEFAULT_EXTRA_ITEMS = 4;
	static final int REGEX_ATTEMPTS = 1000;
	static final double DEFAULT_NUMBER_RANGE = 1_000_000;

	private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789 _-.";

	private ArbitraryGenerator() { }

	public static Arbitrary arbitrary(Type type) {
		return arbitrary(type, DEFAULT_MAX_DEPTH);
	}

	/**
	 * @return an {@link Arbitrary} whose top-level absent values are represented as null
	 */
	public static Arbitrary arbitrary(Type type, int maxDepth) {
		Map<UnionType, List<Type>> baseVariants = Collections.synchronizedMap(new IdentityHashMap<>());
		return random -> absentToNull(generate(type, maxDepth, random, baseVariants));
	}

	/**
	 * @param baseVariants caches {@link #terminatingVariants} per union
	 * @return a generated value, or {@link Absent#VALUE} for an absent optional
	 */
	static Object generate(Type type, int maxDepth, Random random, Map<UnionType, List<Type>> baseVariants) {
		if (maxDepth < RECURSION_LIMIT) {
			throw new ArbitraryGenerationException("Recursion too deep generating " + type + "; does a type contain itself through required fields?");
		}
		ConcreteType concrete = Types.concretise(type);
		return switch (concrete.kind()) {
			case STRING -> generateString((StringType) concrete, random);
			case NUMBER -> generateNumber(((NumberType) concrete).options(), random);
			case BOOLEAN -> random.nextBoolean();
			case LITERAL -> ((LiteralType) concrete).value();
			case ENUM -> {
				List<String> variants = ((EnumType) concrete).variants();
				yield variants.get(random.nextInt(variants.size()));
			}
			case OBJECT, ENTITY -> generateFields((FieldsType) concrete, maxDepth, random, baseVariants);
			case ARRAY -> generateArray((ArrayType) concrete, maxDepth, random, baseVariants);
			case OPTIONAL -> (maxDepth <= 0 || random.nextInt(3) == 0)
				? Absent.VALUE
				: generate(((WrapperType) concrete).wrappedType(), maxDepth - 1, random, baseVariants);
			case NULLABLE -> (maxDepth <= 0 || random.nextInt(3) == 0)
				? null
				: absentToNull(generate(((WrapperType) concrete).wrappedType(), maxDepth - 1, random, baseVariants));
			case REFERENCE -> generate(((WrapperType) concrete).wrappedType(), maxDepth, random, baseVariants);
			case UNION -> generateUnion((UnionType) concrete, maxDepth, random, baseVariants);
			case CUSTOM -> generateCustom((CustomType<?>) concrete, maxDepth, random);
		};
	}

	private static String generateString(StringType type, Random random) {
		StringOptions options = type.options();
		int minLength = options.minLength() == null ? 0 : options.minLength();
		int maxLength = options.maxLength() == null ? minLength + DEFAULT_EXTRA_LENGTH : options.maxLength();
		Pattern regex = options.regex();
		if (regex == null) {
			return randomString(minLength, maxLength, random);
		}

		RegexGenerator generator;
		try {
			generator = RegexGenerator.parse(regex.pattern());
		} catch (RegexGenerator.UnsupportedRegexException e) {
			LOGGER.debug("Falling back to rejection sampling for /{}/: {}", regex.pattern(), e.getMessage());
			generator = null;
		}
		for (int i = 0; i < REGEX_ATTEMPTS; i++) {
			String candidate = (generator == null)
				? randomString(minLength, maxLength, random)
				: generator.generate(random);
			if (candidate.length() >= minLength && candidate.length() <= maxLength && regex.matcher(candidate).matches()) {
				return candidate;
			}
		}
		throw new ArbitraryGenerationException("Unable to generate a string of length "
			+ minLength + ".." + maxLength + " matching /" + regex.pattern() + "/");
	}

	private static String randomString(int minLength, int maxLength, Random random) {
		int length = minLength + random.nextInt(maxLength - minLength + 1);
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
		}
		return sb.toString();
	}

	private static Number generateNumber(NumberOptions options, Random random) {
		if (options.isInteger()) {
			long lower = Long.MIN_VALUE;
			if (options.minimum() != null) {
				lower = (long) Math.ceil(options.minimum());
			}
			if (options.exclusiveMinimum() != null) {
				lower = Math.max(lower, (long) Math.floor(options.exclusiveMinimum()) + 1);
			}
			long upper = Long.MAX_VALUE;
			if (options.maximum() != null) {
				upper = (long) Math.floor(options.maximum());
			}
			if (options.exclusiveMaximum() != null) {
				upper = Math.min(upper, (long) Math.ceil(options.exclusiveMaximum()) - 1);
			}
			long range = (long) DEFAULT_NUMBER_RANGE;
			if (lower == Long.MIN_VALUE && upper == Long.MAX_VALUE) {
				lower = -range;
				upper = range;
			} else if (lower == Long.MIN_VALUE) {
				lower = upper - 2 * range;
			} else if (upper == Long.MAX_VALUE) {
				upper = lower + 2 * range;
			}
			return (Long) Arbitrary.integer(lower, upper).generate(random);
		} else {
			double lower = Double.NEGATIVE_INFINITY;
			if (options.minimum() != null) {
				lower = options.minimum();
			}
			if (options.exclusiveMinimum() != null) {
				lower = Math.max(lower, Math.nextUp(options.exclusiveMinimum()));
			}
			double upper = Double.POSITIVE_INFINITY;
			if (options.maximum() != null) {
				upper = options.maximum();
			}
			if (options.exclusiveMaximum() != null) {
				upper = Math.min(upper, Math.nextDown(options.exclusiveMaximum()));
			}
			if (lower == Double.NEGATIVE_INFINITY && upper == Double.POSITIVE_INFINITY) {
				lower = -DEFAULT_NUMBER_RANGE;
				upper = DEFAULT_NUMBER_RANGE;
			} else if (lower == Double.NEGATIVE_INFINITY) {
				lower = upper - 2 * DEFAULT_NUMBER_RANGE;
			} else if (upper == Double.POSITIVE_INFINITY) {
				upper = lower + 2 * DEFAULT_NUMBER_RANGE;
			}
			double result = lower + random.nextDouble() * (upper - lower);
			// Rounding can land exactly on an excluded bound
			return Math.max(lower, Math.min(upper, result));
		}
	}

	private static Map<String, Object> generateFields(FieldsType type, int maxDepth, Random random, Map<UnionType, List<Type>> baseVariants) {
		Map<String, Object> result = new LinkedHashMap<>();
		type.fields().forEach((name, fieldType) -> {
			Object value = generate(fieldType, maxDepth - 1, random, baseVariants);
			if (value != Absent.VALUE) {
				result.put(name, value);
			}
		});
		return type.mutability() == Mutability.MUTABLE ? result : Collections.unmodifiableMap(result);
	}

	private static List<Object> generateArray(ArrayType type, int maxDepth, Random random, Map<UnionType, List<Type>> baseVariants) {
		int minItems = type.options().minItems() == null ? 0 : type.options().minItems();
		int size;
		if (maxDepth <= 0) {
			size = minItems;
		} else {
			int maxItems = type.options().maxItems() == null ? minItems + DEFAULT_EXTRA_ITEMS : type.options().maxItems();
			size = minItems + random.nextInt(maxItems - minItems + 1);
		}
		List<Object> result = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			result.add(absentToNull(generate(type.wrappedType(), maxDepth - 1, random, baseVariants)));
		}
		return type.mutability() == Mutability.MUTABLE ? result : Collections.unmodifiableList(result);
	}

	private static Object generateUnion(UnionType type, int maxDepth, Random random, Map<UnionType, List<Type>> baseVariants) {
		List<Type> variants = (maxDepth <= 0)
			? baseVariants.computeIfAbsent(type, ArbitraryGenerator::terminatingVariants)
			: List.copyOf(type.variants().values());
		return generate(variants.get(random.nextInt(variants.size())), maxDepth - 1, random, baseVariants);
	}

	/**
	 * The variants whose values can be generated without coming back to {@code type}
	 * once the depth budget is spent; all of them if there are none.
	 */
	static List<Type> terminatingVariants(UnionType type) {
		List<Type> result = new ArrayList<>();
		for (Type variant: type.variants().values()) {
			Set<ConcreteType> visiting = Collections.newSetFromMap(new IdentityHashMap<>());
			visiting.add(type);
			if (terminates(variant, visiting)) {
				result.add(variant);
			}
		}
		if (result.isEmpty()) {
			LOGGER.debug("Every variant of {} recurses; choosing among all of them", type);
			return List.copyOf(type.variants().values());
		}
		return result;
	}

	/**
	 * Whether a value of {@code type} can be generated at depth zero
	 * without reaching any of the types in {@code visiting}.
	 */
	private static boolean terminates(Type type, Set<ConcreteType> visiting) {
		ConcreteType concrete = Types.concretise(type);
		if (!visiting.add(concrete)) {
			return false;
		}
		try {
			return switch (concrete.kind()) {
				case STRING, NUMBER, BOOLEAN, LITERAL, ENUM, CUSTOM, OPTIONAL, NULLABLE -> true;
				case REFERENCE -> terminates(((WrapperType) concrete).wrappedType(), visiting);
				case ARRAY -> {
					ArrayType array = (ArrayType) concrete;
					Integer minItems = array.options().minItems();
					yield minItems == null || minItems == 0 || terminates(array.wrappedType(), visiting);
				}
				case OBJECT, ENTITY -> ((FieldsType) concrete).fields().values().stream()
					.allMatch(fieldType -> terminates(fieldType, visiting));
				case UNION -> ((UnionType) concrete).variants().values().stream()
					.anyMatch(variant -> terminates(variant, visiting));
			};
		} finally {
			visiting.remove(concrete);
		}
	}

	private static <O> Object generateCustom(CustomType<O> type, int maxDepth, Random random) {
		return type.behaviour().arbitrary(maxDepth, type.customOptions()).generate(random);
	}

	private static Object absentToNull(Object value) {
		return value == Absent.VALUE ? null : value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArbitraryGenerator.class);
}
