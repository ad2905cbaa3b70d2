package works.strata.path;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.pcollections.ConsPStack;
import org.pcollections.PStack;

import static java.util.Objects.requireNonNull;

/**
 * An immutable trail of {@link Segment}s from the root of a value to one of its parts.
 * Used only to locate errors.
 * <p>
 * Errors are built from the inside out, so the cheap operations are the
 * {@code prepend} ones.
 * <p>
 * Renders in a JSONPath-like syntax: {@code $.users[3].name}.
 * Union variants render as {@code {variantName}}.
 */
public final class Path implements Iterable<Segment> {
	private static final Path ROOT = new Path(ConsPStack.empty());

	private final PStack<Segment> segments;

	private Path(PStack<Segment> segments) {
		this.segments = segments;
	}

	public static Path root() {
		return ROOT;
	}

	public static Path of(Segment... segments) {
		PStack<Segment> result = ConsPStack.empty();
		for (int i = segments.length - 1; i >= 0; i--) {
			result = result.plus(requireNonNull(segments[i]));
		}
		return new Path(result);
	}

	public static Path ofField(String name) {
		return root().prependField(name);
	}

	public static Path ofIndex(int index) {
		return root().prependIndex(index);
	}

	public Path prepend(Segment segment) {
		return new Path(segments.plus(requireNonNull(segment)));
	}

	public Path prependField(String name) {
		return prepend(new Segment.Field(name));
	}

	public Path prependIndex(int index) {
		return prepend(new Segment.Index(index));
	}

	public Path prependVariant(String name) {
		return prepend(new Segment.Variant(name));
	}

	public Path append(Segment segment) {
		return new Path(segments.plus(segments.size(), requireNonNull(segment)));
	}

	public Path appendField(String name) {
		return append(new Segment.Field(name));
	}

	public Path appendIndex(int index) {
		return append(new Segment.Index(index));
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public int length() {
		return segments.size();
	}

	public List<Segment> segments() {
		return List.copyOf(segments);
	}

	@Override
	public Iterator<Segment> iterator() {
		return segments().iterator();
	}

	/**
	 * The inverse of {@link #toString} for paths with no {@link Segment.Variant variant} segments
	 * that are ambiguous, which is good enough for tests and log analysis.
	 *
	 * @throws IllegalArgumentException if the string isn't a valid path
	 */
	public static Path parse(String path) {
		if (!path.startsWith("$")) {
			throw new IllegalArgumentException("Path must start with '$': " + path);
		}
		List<Segment> result = new ArrayList<>();
		int i = 1;
		while (i < path.length()) {
			char c = path.charAt(i);
			if (c == '.') {
				int end = i + 1;
				while (end < path.length() && ".[{".indexOf(path.charAt(end)) < 0) {
					end++;
				}
				result.add(new Segment.Field(path.substring(i + 1, end)));
				i = end;
			} else if (path.startsWith("['", i)) {
				StringBuilder name = new StringBuilder();
				int j = i + 2;
				while (j < path.length() && path.charAt(j) != '\'') {
					if (path.charAt(j) == '\\' && j + 1 < path.length()) {
						j++;
					}
					name.append(path.charAt(j));
					j++;
				}
				if (!path.startsWith("']", j)) {
					throw new IllegalArgumentException("Unterminated field name in " + path);
				}
				result.add(new Segment.Field(name.toString()));
				i = j + 2;
			} else if (c == '[') {
				int end = path.indexOf(']', i);
				if (end < 0) {
					throw new IllegalArgumentException("Unterminated index in " + path);
				}
				try {
					result.add(new Segment.Index(Integer.parseInt(path.substring(i + 1, end))));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid index in " + path, e);
				}
				i = end + 1;
			} else if (c == '{') {
				int end = path.indexOf('}', i);
				if (end < 0) {
					throw new IllegalArgumentException("Unterminated variant in " + path);
				}
				result.add(new Segment.Variant(path.substring(i + 1, end)));
				i = end + 1;
			} else {
				throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + i + " of " + path);
			}
		}
		return of(result.toArray(new Segment[0]));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Path other && segments.equals(other.segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("$");
		segments.forEach(sb::append);
		return sb.toString();
	}
}
