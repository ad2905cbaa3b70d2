package works.strata.encoding;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.strata.Fixtures;
import works.strata.exceptions.TypeGraphException;
import works.strata.options.EncodingOptions;
import works.strata.options.EncodingOptions.SensitiveInformationStrategy;
import works.strata.types.StringOptions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.strata.types.Types.array;
import static works.strata.types.Types.members;
import static works.strata.types.Types.nullable;
import static works.strata.types.Types.number;
import static works.strata.types.Types.object;
import static works.strata.types.Types.optional;
import static works.strata.types.Types.string;

class EncoderTest {
	static final Encoder KEEP = new Encoder(EncodingOptions.DEFAULT);
	static final Encoder HIDE = new Encoder(new EncodingOptions(SensitiveInformationStrategy.HIDE));

	@Test
	void union_isWrappedInItsVariantName() {
		assertEquals(Map.of("circle", Map.of("radius", 1L)), KEEP.encode(Fixtures.SHAPE, Map.of("radius", 1L)));
		assertEquals(Map.of("label", "hi"), KEEP.encode(Fixtures.SHAPE, "hi"));
	}

	@Test
	void unionInsideArray() {
		assertEquals(
			List.of(Map.of("square", Map.of("side", 2L)), Map.of("label", "x")),
			KEEP.encode(array(Fixtures.SHAPE), List.of(Map.of("side", 2L), "x")));
	}

	@Test
	void absentOptionalField_isOmittedButNullIsKept() {
		var type = object(members()
			.with("a", string())
			.with("b", optional(number()))
			.with("c", nullable(number())));
		Map<String, Object> value = new HashMap<>();
		value.put("a", "x");
		value.put("c", null);

		var encoded = (Map<?, ?>) KEEP.encode(type, value);
		assertEquals(List.of("a", "c"), List.copyOf(encoded.keySet()));
		assertNull(encoded.get("c"));
	}

	@Test
	void sensitiveValues_hiddenOnlyWhenAsked() {
		var secret = string(StringOptions.builder().sensitive(true).build());
		var type = object(members()
			.with("user", string())
			.with("password", secret)
			.with("hint", optional(secret)));
		var value = Map.of("user", "u", "password", "hunter2", "hint", "h");

		assertEquals(value, KEEP.encode(type, value));

		var hidden = (Map<?, ?>) HIDE.encode(type, value);
		assertEquals("u", hidden.get("user"));
		assertTrue(hidden.containsKey("password"));
		assertNull(hidden.get("password"));
		assertFalse(hidden.containsKey("hint"));
	}

	@Test
	void cyclicType_encodes() {
		var value = Map.of("name", "a", "bestFriend", Map.of("name", "b"));
		assertEquals(value, KEEP.encode(Fixtures.USER, value));
	}

	@Test
	void wrongShape_throws() {
		assertThrows(TypeGraphException.class, () -> KEEP.encode(array(string()), "nope"));
		assertThrows(TypeGraphException.class, () -> KEEP.encode(Fixtures.SHAPE, 5L));
	}
}
