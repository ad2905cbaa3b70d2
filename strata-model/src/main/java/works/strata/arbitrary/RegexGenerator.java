package works.strata.arbitrary;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

/**
 * Generates strings matching a regular expression, for the common subset of the syntax:
 * literals, escapes, character classes, groups, alternation, and greedy or lazy quantifiers.
 * <p>
 * Generated characters are limited to printable ASCII.
 * Lookarounds, backreferences and inline flags are not supported;
 * {@link #parse} throws {@link UnsupportedRegexException} for them.
 */
final class RegexGenerator {
	private static final int UNBOUNDED_EXTRA = 4;
	private static final BitSet PRINTABLE = range(' ', '~');

	private final Node root;

	private RegexGenerator(Node root) {
		this.root = root;
	}

	static RegexGenerator parse(String regex) {
		Parser parser = new Parser(regex);
		Node node = parser.alternation();
		if (parser.pos != regex.length()) {
			throw new UnsupportedRegexException("Unexpected '" + regex.charAt(parser.pos) + "' at position " + parser.pos + " of " + regex);
		}
		return new RegexGenerator(node);
	}

	String generate(Random random) {
		StringBuilder sb = new StringBuilder();
		root.generate(random, sb);
		return sb.toString();
	}

	static final class UnsupportedRegexException extends RuntimeException {
		UnsupportedRegexException(String message) {
			super(message);
		}
	}

	private sealed interface Node permits Sequence, Alternation, Repeat, CharSet {
		void generate(Random random, StringBuilder sb);
	}

	private record Sequence(List<Node> nodes) implements Node {
		@Override
		public void generate(Random random, StringBuilder sb) {
			nodes.forEach(n -> n.generate(random, sb));
		}
	}

	private record Alternation(List<Node> options) implements Node {
		@Override
		public void generate(Random random, StringBuilder sb) {
			options.get(random.nextInt(options.size())).generate(random, sb);
		}
	}

	/**
	 * @param max -1 means unbounded
	 */
	private record Repeat(Node node, int min, int max) implements Node {
		@Override
		public void generate(Random random, StringBuilder sb) {
			int upper = (max < 0) ? min + UNBOUNDED_EXTRA : max;
			int count = min + random.nextInt(upper - min + 1);
			for (int i = 0; i < count; i++) {
				node.generate(random, sb);
			}
		}
	}

	private record CharSet(BitSet chars) implements Node {
		@Override
		public void generate(Random random, StringBuilder sb) {
			int n = random.nextInt(chars.cardinality());
			int c = chars.nextSetBit(0);
			for (int i = 0; i < n; i++) {
				c = chars.nextSetBit(c + 1);
			}
			sb.append((char) c);
		}
	}

	private static final class Parser {
		final String regex;
		int pos = 0;

		Parser(String regex) {
			this.regex = regex;
		}

		Node alternation() {
			List<Node> options = new ArrayList<>();
			options.add(sequence());
			while (peek('|')) {
				pos++;
				options.add(sequence());
			}
			return options.size() == 1 ? options.get(0) : new Alternation(options);
		}

		Node sequence() {
			List<Node> nodes = new ArrayList<>();
			while (pos < regex.length() && !peek('|') && !peek(')')) {
				char c = regex.charAt(pos);
				if (c == '^' || c == '$') {
					// Anchors are implied: generated strings are matched in full
					pos++;
					continue;
				}
				Node atom = atom();
				nodes.add(quantified(atom));
			}
			return new Sequence(nodes);
		}

		Node atom() {
			char c = regex.charAt(pos++);
			switch (c) {
				case '(' -> {
					if (peek('?')) {
						if (regex.startsWith("?:", pos)) {
							pos += 2;
						} else if (regex.startsWith("?<", pos) && pos + 2 < regex.length()
							&& regex.charAt(pos + 2) != '=' && regex.charAt(pos + 2) != '!') {
							int end = regex.indexOf('>', pos);
							if (end < 0) {
								throw new UnsupportedRegexException("Unterminated group name in " + regex);
							}
							pos = end + 1;
						} else {
							throw new UnsupportedRegexException("Unsupported group construct in " + regex);
						}
					}
					Node inner = alternation();
					expect(')');
					return inner;
				}
				case '[' -> {
					return charClass();
				}
				case '.' -> {
					BitSet any = (BitSet) PRINTABLE.clone();
					return new CharSet(any);
				}
				case '\\' -> {
					return new CharSet(escape());
				}
				case '*', '+', '?', '{' -> throw new UnsupportedRegexException("Dangling quantifier at position " + (pos - 1) + " of " + regex);
				default -> {
					return new CharSet(single(c));
				}
			}
		}

		Node quantified(Node atom) {
			if (pos >= regex.length()) {
				return atom;
			}
			int min;
			int max;
			char c = regex.charAt(pos);
			switch (c) {
				case '*' -> { min = 0; max = -1; pos++; }
				case '+' -> { min = 1; max = -1; pos++; }
				case '?' -> { min = 0; max = 1; pos++; }
				case '{' -> {
					int end = regex.indexOf('}', pos);
					if (end < 0) {
						throw new UnsupportedRegexException("Unterminated quantifier in " + regex);
					}
					String body = regex.substring(pos + 1, end);
					try {
						int comma = body.indexOf(',');
						if (comma < 0) {
							min = max = Integer.parseInt(body.trim());
						} else {
							min = Integer.parseInt(body.substring(0, comma).trim());
							String upper = body.substring(comma + 1).trim();
							max = upper.isEmpty() ? -1 : Integer.parseInt(upper);
						}
					} catch (NumberFormatException e) {
						throw new UnsupportedRegexException("Invalid quantifier {" + body + "} in " + regex);
					}
					pos = end + 1;
				}
				default -> {
					return atom;
				}
			}
			// Lazy and possessive modifiers don't change what matches in full
			if (peek('?') || peek('+')) {
				pos++;
			}
			return new Repeat(atom, min, max);
		}

		Node charClass() {
			boolean negated = false;
			if (peek('^')) {
				negated = true;
				pos++;
			}
			BitSet chars = new BitSet();
			boolean first = true;
			while (pos < regex.length() && (first || !peek(']'))) {
				first = false;
				char c = regex.charAt(pos++);
				BitSet item;
				if (c == '\\') {
					item = escape();
				} else if (c == '[') {
					throw new UnsupportedRegexException("Nested character classes are not supported in " + regex);
				} else {
					item = single(c);
				}
				if (item.cardinality() == 1 && peek('-') && pos + 1 < regex.length() && regex.charAt(pos + 1) != ']') {
					pos++;
					char hi = regex.charAt(pos++);
					if (hi == '\\') {
						BitSet escaped = escape();
						if (escaped.cardinality() != 1) {
							throw new UnsupportedRegexException("Invalid range in " + regex);
						}
						hi = (char) escaped.nextSetBit(0);
					}
					char lo = (char) item.nextSetBit(0);
					if (hi < lo) {
						throw new UnsupportedRegexException("Invalid range " + lo + "-" + hi + " in " + regex);
					}
					chars.or(range(lo, hi));
				} else {
					chars.or(item);
				}
			}
			expect(']');
			if (negated) {
				BitSet result = (BitSet) PRINTABLE.clone();
				result.andNot(chars);
				chars = result;
			}
			if (chars.isEmpty()) {
				throw new UnsupportedRegexException("Character class matches no printable character in " + regex);
			}
			return new CharSet(chars);
		}

		BitSet escape() {
			if (pos >= regex.length()) {
				throw new UnsupportedRegexException("Trailing backslash in " + regex);
			}
			char c = regex.charAt(pos++);
			return switch (c) {
				case 'd' -> range('0', '9');
				case 'D' -> complement(range('0', '9'));
				case 'w' -> word();
				case 'W' -> complement(word());
				case 's' -> single(' ');
				case 'S' -> complement(single(' '));
				case 't' -> single('\t');
				case 'n' -> single('\n');
				case 'r' -> single('\r');
				case 'u' -> {
					if (pos + 4 > regex.length()) {
						throw new UnsupportedRegexException("Truncated unicode escape in " + regex);
					}
					try {
						char u = (char) Integer.parseInt(regex.substring(pos, pos + 4), 16);
						pos += 4;
						yield single(u);
					} catch (NumberFormatException e) {
						throw new UnsupportedRegexException("Invalid unicode escape in " + regex);
					}
				}
				case 'b', 'B', 'A', 'z', 'Z', 'G' -> throw new UnsupportedRegexException("Unsupported boundary \\" + c + " in " + regex);
				default -> {
					if (Character.isDigit(c)) {
						throw new UnsupportedRegexException("Backreferences are not supported in " + regex);
					}
					if (Character.isLetter(c)) {
						throw new UnsupportedRegexException("Unsupported escape \\" + c + " in " + regex);
					}
					yield single(c);
				}
			};
		}

		boolean peek(char c) {
			return pos < regex.length() && regex.charAt(pos) == c;
		}

		void expect(char c) {
			if (!peek(c)) {
				throw new UnsupportedRegexException("Expected '" + c + "' at position " + pos + " of " + regex);
			}
			pos++;
		}
	}

	private static BitSet single(char c) {
		BitSet result = new BitSet();
		result.set(c);
		return result;
	}

	private static BitSet range(char lo, char hi) {
		BitSet result = new BitSet();
		result.set(lo, hi + 1);
		return result;
	}

	private static BitSet word() {
		BitSet result = range('a', 'z');
		result.or(range('A', 'Z'));
		result.or(range('0', '9'));
		result.set('_');
		return result;
	}

	private static BitSet complement(BitSet chars) {
		BitSet result = (BitSet) PRINTABLE.clone();
		result.andNot(chars);
		return result;
	}
}
