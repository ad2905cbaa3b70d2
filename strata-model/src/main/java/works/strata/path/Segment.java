package works.strata.path;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * One step of a {@link Path}.
 */
public sealed interface Segment {

	record Field(String name) implements Segment {
		private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

		public Field {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			if (SIMPLE_NAME.matcher(name).matches()) {
				return "." + name;
			} else {
				return "['" + name.replace("\\", "\\\\").replace("'", "\\'") + "']";
			}
		}
	}

	record Index(int index) implements Segment {
		public Index {
			if (index < 0) {
				throw new IllegalArgumentException("Negative index: " + index);
			}
		}

		@Override
		public String toString() {
			return "[" + index + "]";
		}
	}

	/**
	 * Marks that the value was interpreted as the given variant of a union.
	 */
	record Variant(String name) implements Segment {
		public Variant {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return "{" + name + "}";
		}
	}
}
