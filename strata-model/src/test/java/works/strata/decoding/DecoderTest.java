package works.strata.decoding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.strata.Fixtures;
import works.strata.options.DecodingOptions;
import works.strata.options.ErrorReportingStrategy;
import works.strata.options.FieldStrictness;
import works.strata.options.TypeCastingStrategy;
import works.strata.path.Path;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.types.Absent;
import works.strata.types.StringOptions;
import works.strata.types.Type;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.strata.types.Types.array;
import static works.strata.types.Types.bool;
import static works.strata.types.Types.enumeration;
import static works.strata.types.Types.integer;
import static works.strata.types.Types.literal;
import static works.strata.types.Types.members;
import static works.strata.types.Types.mutableArray;
import static works.strata.types.Types.nullable;
import static works.strata.types.Types.number;
import static works.strata.types.Types.object;
import static works.strata.types.Types.optional;
import static works.strata.types.Types.reference;
import static works.strata.types.Types.string;

class DecoderTest {
	static final DecodingOptions EXACT = DecodingOptions.DEFAULT;
	static final DecodingOptions CASTING = DecodingOptions.DEFAULT.withTypeCastingStrategy(TypeCastingStrategy.TRY_CASTING);
	static final DecodingOptions ALL_ERRORS = DecodingOptions.DEFAULT.withErrorReportingStrategy(ErrorReportingStrategy.ALL_ERRORS);
	static final DecodingOptions ADDITIONAL_FIELDS = DecodingOptions.DEFAULT.withFieldStrictness(FieldStrictness.ALLOW_ADDITIONAL_FIELDS);

	static Result<Object, List<DecodingError>> decode(Type type, Object raw, DecodingOptions options) {
		return new Decoder(options).decode(type, raw);
	}

	@ParameterizedTest(name = "{0} decodes {1} as {2}")
	@MethodSource("exactSuccesses")
	void exact_accepts(Type type, Object raw, Object expected) {
		var result = decode(type, raw, EXACT);
		assertTrue(result.isOk(), () -> "Unexpected: " + result);
		assertEquals(expected, result.value());
	}

	static Stream<Arguments> exactSuccesses() {
		return Stream.of(
			arguments(string(), "hello", "hello"),
			arguments(number(), 42, 42L),
			arguments(number(), 1.5, 1.5),
			arguments(number(), 2.0, 2.0),
			arguments(integer(), 7L, 7L),
			arguments(bool(), true, true),
			arguments(literal("x"), "x", "x"),
			arguments(literal(1), 1.0, 1L),
			arguments(literal(null), null, null),
			arguments(enumeration("red", "green"), "green", "green"),
			arguments(optional(string()), Absent.VALUE, null),
			arguments(optional(string()), null, null),
			arguments(nullable(string()), null, null),
			arguments(reference(number()), 3, 3L),
			arguments(array(number()), List.of(1, 2), List.of(1L, 2L))
		);
	}

	@ParameterizedTest(name = "{0} rejects {1}")
	@MethodSource("exactFailures")
	void exact_rejects(Type type, Object raw, String expected) {
		var result = decode(type, raw, EXACT);
		assertEquals(List.of(new DecodingError(Path.root(), expected, raw)), result.error());
	}

	static Stream<Arguments> exactFailures() {
		return Stream.of(
			arguments(string(), 1, "string"),
			arguments(string(), Absent.VALUE, "string"),
			arguments(number(), "42", "number"),
			arguments(integer(), "42", "integer"),
			arguments(number(), Double.NaN, "number"),
			arguments(bool(), "true", "boolean"),
			arguments(literal("x"), "y", "literal (x)"),
			arguments(literal(null), "null", "literal (null)"),
			arguments(enumeration("red", "green"), "blue", "enum (\"red\" | \"green\")"),
			arguments(array(number()), Map.of("0", 1), "array"),
			arguments(object(members().with("a", string())), List.of(), "object"),
			arguments(object(members().with("a", string())), null, "object"),
			arguments(optional(string()), 3, "string or undefined"),
			arguments(nullable(string()), 3, "string or null"),
			arguments(nullable(string()), Absent.VALUE, "string or null")
		);
	}

	@ParameterizedTest(name = "{0} casts {1} to {2}")
	@MethodSource("castingSuccesses")
	void casting_accepts(Type type, Object raw, Object expected) {
		var result = decode(type, raw, CASTING);
		assertTrue(result.isOk(), () -> "Unexpected: " + result);
		assertEquals(expected, result.value());
	}

	static Stream<Arguments> castingSuccesses() {
		return Stream.of(
			arguments(number(), "42", 42L),
			arguments(number(), " 4.25 ", 4.25),
			arguments(number(), "1e3", 1000L),
			arguments(string(), 12, "12"),
			arguments(string(), 1.5, "1.5"),
			arguments(string(), 2.0, "2"),
			arguments(string(), false, "false"),
			arguments(bool(), "true", true),
			arguments(bool(), "false", false),
			arguments(bool(), 0, false),
			arguments(bool(), 3, true),
			arguments(literal(null), "null", null),
			arguments(nullable(string()), Absent.VALUE, null),
			arguments(array(string()), Map.of("1", "b", "0", "a"), List.of("a", "b")),
			arguments(array(string()), Map.of(), List.of()),
			arguments(object(members().with("a", optional(string()))), null, Map.of())
		);
	}

	@ParameterizedTest(name = "{0} can't cast {1}")
	@MethodSource("castingFailures")
	void casting_rejects(Type type, Object raw) {
		assertTrue(decode(type, raw, CASTING).isFailure());
	}

	static Stream<Arguments> castingFailures() {
		return Stream.of(
			arguments(number(), "forty-two"),
			arguments(number(), ""),
			arguments(number(), "NaN"),
			arguments(number(), "Infinity"),
			arguments(bool(), "yes"),
			arguments(array(string()), Map.of("0", "a", "2", "c")),
			arguments(array(string()), Map.of("x", "a"))
		);
	}

	@Test
	void castingBoundary() {
		assertTrue(decode(number(), "42", EXACT).isFailure());
		assertEquals(42L, decode(number(), "42", CASTING).value());
	}

	@Test
	void strictnessBoundary() {
		var type = object(members().with("name", string()));
		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("name", "x");
		raw.put("extra", 1);

		var strict = decode(type, raw, EXACT);
		assertEquals(List.of(new DecodingError(Path.ofField("extra"), "undefined", 1)), strict.error());

		var lenient = decode(type, raw, ADDITIONAL_FIELDS);
		assertEquals(Map.of("name", "x"), lenient.value());
	}

	@Test
	void object_absentOptionalFieldsAreOmitted() {
		var type = object(members()
			.with("a", string())
			.with("b", optional(number()))
			.with("c", nullable(number())));
		Map<String, Object> raw = new HashMap<>();
		raw.put("a", "x");
		raw.put("c", null);
		Object decoded = decode(type, raw, EXACT).value();
		Map<String, Object> expected = new HashMap<>();
		expected.put("a", "x");
		expected.put("c", null);
		assertEquals(expected, decoded);
		assertFalse(((Map<?, ?>) decoded).containsKey("b"));
	}

	@Test
	void object_missingRequiredField() {
		var type = object(members().with("a", string()));
		assertEquals(
			List.of(new DecodingError(Path.ofField("a"), "string", Absent.VALUE)),
			decode(type, Map.of(), EXACT).error());
	}

	@Test
	void object_preservesDeclarationOrder() {
		var type = object(members().with("z", number()).with("a", number()));
		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("a", 1);
		raw.put("z", 2);
		assertEquals(List.of("z", "a"), List.copyOf(((Map<?, ?>) decode(type, raw, EXACT).value()).keySet()));
	}

	@Test
	void object_isImmutableUnlessMutable() {
		var decoded = (Map<?, ?>) decode(object(members().with("a", number())), Map.of("a", 1), EXACT).value();
		assertThrows(UnsupportedOperationException.class, decoded::clear);

		var list = decode(mutableArray(number()), List.of(1), EXACT).value();
		assertTrue(list instanceof ArrayList<?>);
	}

	@Test
	void stopAtFirstError_reportsOneError() {
		var result = decode(array(number()), List.of("a", 1, "b"), EXACT);
		assertEquals(List.of(new DecodingError(Path.ofIndex(0), "number", "a")), result.error());
	}

	@Test
	void allErrors_reportsEveryErrorInOrder() {
		var type = object(members()
			.with("name", string())
			.with("scores", array(number())));
		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("name", 5);
		raw.put("scores", List.of(1, "two", 3, "four"));
		raw.put("extra", true);
		var result = decode(type, raw, ALL_ERRORS);
		assertEquals(List.of(
			new DecodingError(Path.ofField("name"), "string", 5),
			new DecodingError(Path.ofIndex(1).prependField("scores"), "number", "two"),
			new DecodingError(Path.ofIndex(3).prependField("scores"), "number", "four"),
			new DecodingError(Path.ofField("extra"), "undefined", true)
		), result.error());
	}

	@Test
	void stopAtFirstError_checksUnexpectedFieldsFirst() {
		var type = object(members().with("name", string()));
		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("name", 5);
		raw.put("extra", true);
		assertEquals(
			List.of(new DecodingError(Path.ofField("extra"), "undefined", true)),
			decode(type, raw, EXACT).error());
	}

	@Test
	void wrappers_amendNestedErrors() {
		var fields = object(members().with("a", number()));
		assertEquals(
			List.of(new DecodingError(Path.ofField("a"), "number or undefined", "x")),
			decode(optional(fields), Map.of("a", "x"), EXACT).error());
		assertEquals(
			List.of(new DecodingError(Path.ofField("a"), "number or null", "x")),
			decode(nullable(fields), Map.of("a", "x"), EXACT).error());
		assertEquals(
			List.of(new DecodingError(Path.ofField("b"), "undefined", 1)),
			decode(optional(fields), Map.of("a", 1, "b", 1), EXACT).error());
	}

	@Test
	void optional_nullFallsBackToAbsent() {
		var type = object(members().with("a", optional(number())));
		Map<String, Object> raw = new HashMap<>();
		raw.put("a", null);
		assertEquals(Map.of(), decode(type, raw, EXACT).value());
	}

	@Test
	void array_absentElementsBecomeNull() {
		List<Object> raw = new ArrayList<>();
		raw.add(1);
		raw.add(Absent.VALUE);
		List<Object> expected = new ArrayList<>();
		expected.add(1L);
		expected.add(null);
		assertEquals(expected, decode(array(optional(number())), raw, EXACT).value());
	}

	@Test
	void cyclicType_decodes() {
		Map<String, Object> raw = Map.of(
			"name", "a",
			"bestFriend", Map.of(
				"name", "b",
				"bestFriend", Map.of("name", "c")));
		assertEquals(raw, decode(Fixtures.USER, raw, EXACT).value());

		var bad = Map.of("name", "a", "bestFriend", Map.of("name", 3));
		assertEquals(
			List.of(new DecodingError(Path.ofField("name").prependField("bestFriend"), "string or undefined", 3)),
			decode(Fixtures.USER, bad, EXACT).error());
	}

	@Test
	void decodingDoesNotValidate() {
		var type = string(StringOptions.builder().maxLength(1).build());
		assertEquals("too long", decode(type, "too long", EXACT).value());
	}
}
