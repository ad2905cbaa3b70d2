package works.strata.validation;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.strata.Fixtures;
import works.strata.arbitrary.ArbitraryGenerator;
import works.strata.options.ErrorReportingStrategy;
import works.strata.options.ValidationOptions;
import works.strata.path.Path;
import works.strata.result.ValidationError;
import works.strata.types.ArrayOptions;
import works.strata.types.NumberOptions;
import works.strata.types.StringOptions;
import works.strata.types.Type;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.strata.types.Types.array;
import static works.strata.types.Types.integer;
import static works.strata.types.Types.members;
import static works.strata.types.Types.nullable;
import static works.strata.types.Types.number;
import static works.strata.types.Types.object;
import static works.strata.types.Types.optional;
import static works.strata.types.Types.string;
import static works.strata.types.Types.union;

class ValidatorTest {
	static final Validator STOP_AT_FIRST = new Validator(ValidationOptions.DEFAULT);
	static final Validator ALL_ERRORS = new Validator(new ValidationOptions(ErrorReportingStrategy.ALL_ERRORS));

	@ParameterizedTest(name = "{0} rejects {1}: {2}")
	@MethodSource("violations")
	void violation_isReported(Type type, Object value, String assertion) {
		assertEquals(
			List.of(new ValidationError(Path.root(), assertion, value)),
			STOP_AT_FIRST.validate(type, value).error());
	}

	static Stream<Arguments> violations() {
		return Stream.of(
			arguments(string(StringOptions.builder().maxLength(3).build()), "abcd", "string longer than max length (3)"),
			arguments(string(StringOptions.builder().minLength(2).build()), "a", "string shorter than min length (2)"),
			arguments(string(StringOptions.builder().regex(Pattern.compile("[a-z]+")).build()), "abc1", "string regex mismatch ([a-z]+)"),
			arguments(number(NumberOptions.builder().maximum(10.0).build()), 11L, "number must be less than or equal to 10"),
			arguments(number(NumberOptions.builder().exclusiveMaximum(10.0).build()), 10L, "number must be less than 10"),
			arguments(number(NumberOptions.builder().minimum(0.5).build()), 0.25, "number must be greater than or equal to 0.5"),
			arguments(number(NumberOptions.builder().exclusiveMinimum(0.0).build()), 0L, "number must be greater than 0"),
			arguments(integer(), 1.5, "number must be an integer"),
			arguments(string(), 3L, "value of kind string"),
			arguments(object(members().with("a", string())), "x", "value of kind object")
		);
	}

	@ParameterizedTest(name = "{0} accepts {1}")
	@MethodSource("validValues")
	void validValue_passes(Type type, Object value) {
		assertTrue(STOP_AT_FIRST.validate(type, value).isOk());
	}

	static Stream<Arguments> validValues() {
		return Stream.of(
			arguments(string(StringOptions.builder().minLength(1).maxLength(3).build()), "abc"),
			arguments(string(StringOptions.builder().regex(Pattern.compile("[a-z]+")).build()), "abc"),
			arguments(number(NumberOptions.builder().minimum(0.0).maximum(10.0).build()), 10L),
			arguments(integer(), 2.0),
			arguments(integer(), 2L),
			arguments(optional(string(StringOptions.builder().minLength(3).build())), null),
			arguments(nullable(integer()), null),
			arguments(Fixtures.SHAPE, Map.of("radius", 1L))
		);
	}

	@Test
	void array_checksSizeThenElements() {
		var type = array(string(StringOptions.builder().maxLength(1).build()),
			ArrayOptions.builder().minItems(1).maxItems(2).build());
		assertEquals(
			List.of(new ValidationError(Path.root(), "array must have at most 2 items", 3)),
			STOP_AT_FIRST.validate(type, List.of("a", "b", "c")).error());
		assertEquals(
			List.of(new ValidationError(Path.root(), "array must have at least 1 items", 0)),
			STOP_AT_FIRST.validate(type, List.of()).error());
		assertEquals(
			List.of(new ValidationError(Path.ofIndex(1), "string longer than max length (1)", "bb")),
			STOP_AT_FIRST.validate(type, List.of("a", "bb")).error());
	}

	@Test
	void object_checksOnlyPresentFields() {
		var type = object(members()
			.with("a", string(StringOptions.builder().minLength(2).build()))
			.with("b", integer()));
		assertTrue(STOP_AT_FIRST.validate(type, Map.of("b", 1L)).isOk());
		assertEquals(
			List.of(new ValidationError(Path.ofField("a"), "string shorter than min length (2)", "x")),
			STOP_AT_FIRST.validate(type, Map.of("a", "x")).error());
	}

	@Test
	void allErrors_reportsEveryViolation() {
		var type = object(members()
			.with("name", string(StringOptions.builder().maxLength(2).regex(Pattern.compile("[0-9]*")).build()))
			.with("age", integer(NumberOptions.builder().minimum(0.0).build())));
		var value = Map.of("name", "abc", "age", -1.5);

		assertEquals(1, STOP_AT_FIRST.validate(type, value).error().size());
		assertEquals(List.of(
			new ValidationError(Path.ofField("name"), "string longer than max length (2)", "abc"),
			new ValidationError(Path.ofField("name"), "string regex mismatch ([0-9]*)", "abc"),
			new ValidationError(Path.ofField("age"), "number must be greater than or equal to 0", -1.5),
			new ValidationError(Path.ofField("age"), "number must be an integer", -1.5)
		), ALL_ERRORS.validate(type, value).error());
	}

	@Test
	void union_reportsVariantErrors() {
		var lengths = union(members()
			.with("short", string(StringOptions.builder().maxLength(3).build()))
			.with("long", string(StringOptions.builder().minLength(5).build())));
		assertTrue(STOP_AT_FIRST.validate(lengths, "abcdef").isOk());
		assertEquals(
			List.of(new ValidationError(Path.root().prependVariant("short"), "string longer than max length (3)", "abcd")),
			STOP_AT_FIRST.validate(lengths, "abcd").error());
	}

	@Test
	void union_valueOfNoVariant() {
		assertEquals(
			List.of(new ValidationError(Path.root(), "value matching one of the variants [circle, square, label]", 5L)),
			STOP_AT_FIRST.validate(Fixtures.SHAPE, 5L).error());
	}

	@Test
	void cyclicType_validatesNestedValues() {
		var type = Fixtures.TREE;
		var value = Map.of("value", 1L, "children", List.of(
			Map.of("value", 2.5, "children", List.of())));
		assertEquals(
			List.of(new ValidationError(
				Path.ofField("value").prependIndex(0).prependField("children"),
				"number must be an integer",
				2.5)),
			STOP_AT_FIRST.validate(type, value).error());
	}

	static final Type INNER = union(members()
		.with("s", string())
		.with("o", object(members().with("s", string(StringOptions.builder().minLength(5).build())))));
	static final Type OUTER = union(members()
		.with("w", object(members().with("inner", INNER)))
		.with("q", integer()));

	@Test
	void nestedUnion_singleKeyMapIsNotReadAsTagged() {
		assertEquals(
			List.of(new ValidationError(
				Path.ofField("s").prependVariant("o"),
				"string shorter than min length (5)",
				"hi")),
			STOP_AT_FIRST.validate(INNER, Map.of("s", "hi")).error());
		assertTrue(STOP_AT_FIRST.validate(OUTER, Map.of("inner", Map.of("s", "hi"))).isFailure());
		assertTrue(STOP_AT_FIRST.validate(OUTER, Map.of("inner", Map.of("s", "hello"))).isOk());
		assertTrue(STOP_AT_FIRST.validate(OUTER, Map.of("inner", "hi")).isOk());
	}

	@Test
	void nestedUnion_generatedValuesValidate() {
		for (Object value: ArbitraryGenerator.arbitrary(OUTER).sample(3, 100)) {
			var result = ALL_ERRORS.validate(OUTER, value);
			assertTrue(result.isOk(), () -> value + " fails validation: " + result);
		}
	}
}
