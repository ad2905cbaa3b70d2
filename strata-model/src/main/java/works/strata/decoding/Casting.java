package works.strata.decoding;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Conversions between scalar representations.
 * Each returns empty if the conversion would be ambiguous or lossy.
 */
final class Casting {
	private Casting() { }

	/**
	 * Integral values become {@link Long}; others become {@link Double}.
	 * Floating-point inputs stay {@link Double} so that they encode the same way they arrived.
	 */
	static Optional<Number> normalizeNumber(Number n) {
		if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
			return Optional.of(n.longValue());
		} else if (n instanceof Double || n instanceof Float) {
			double d = n.doubleValue();
			return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
		} else if (n instanceof BigInteger i) {
			return i.bitLength() < 64 ? Optional.of(i.longValue()) : Optional.empty();
		} else if (n instanceof BigDecimal d) {
			return fromBigDecimal(d);
		} else {
			double d = n.doubleValue();
			return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
		}
	}

	static Optional<Number> numberFromString(String s) {
		String trimmed = s.trim();
		if (trimmed.isEmpty()) {
			return Optional.empty();
		}
		try {
			return fromBigDecimal(new BigDecimal(trimmed));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	private static Optional<Number> fromBigDecimal(BigDecimal d) {
		BigDecimal stripped = d.stripTrailingZeros();
		if (stripped.scale() <= 0) {
			try {
				return Optional.of(stripped.longValueExact());
			} catch (ArithmeticException e) {
				// Too big for a long; fall through to double
			}
		}
		double result = d.doubleValue();
		return Double.isFinite(result) ? Optional.of(result) : Optional.empty();
	}

	static String numberToString(Number n) {
		if (n instanceof Double || n instanceof Float) {
			double d = n.doubleValue();
			if (d == Math.rint(d) && Math.abs(d) < 1e15) {
				return Long.toString((long) d);
			} else {
				return Double.toString(d);
			}
		} else {
			return n.toString();
		}
	}

	static Optional<Boolean> booleanFrom(Object raw) {
		if (raw instanceof String s) {
			return switch (s) {
				case "true" -> Optional.of(true);
				case "false" -> Optional.of(false);
				default -> Optional.empty();
			};
		} else if (raw instanceof Number n) {
			return normalizeNumber(n).map(x -> x.doubleValue() != 0);
		} else {
			return Optional.empty();
		}
	}

	static boolean numericEquals(Number a, Number b) {
		if (a instanceof Long x && b instanceof Long y) {
			return x.longValue() == y.longValue();
		} else {
			return a.doubleValue() == b.doubleValue();
		}
	}
}
