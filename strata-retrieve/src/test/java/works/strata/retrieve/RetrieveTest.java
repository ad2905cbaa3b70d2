package works.strata.retrieve;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.strata.Strata;
import works.strata.path.Path;
import works.strata.types.Kind;
import works.strata.types.Type;
import works.strata.types.Types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.strata.types.Types.array;
import static works.strata.types.Types.string;

class RetrieveTest {
	static final String REGISTERED = "2024-01-02T03:04:05Z";

	static Map<String, Object> metadata() {
		return Map.of("registeredAt", REGISTERED, "loggedInAt", REGISTERED);
	}

	static Map<String, Object> post(String title) {
		return Map.of(
			"title", title,
			"content", "Lorem ipsum",
			"tags", List.of());
	}

	@Test
	void selectedType_nullSelectKeepsType() {
		assertSame(RetrieveFixtures.USER, Retrieve.selectedType(RetrieveFixtures.USER, null));
	}

	@Test
	void selectedType_keepsWrappers() {
		Type selected = Retrieve.selectedType(array(RetrieveFixtures.USER), Map.of("name", true));
		assertEquals(Kind.ARRAY, Types.concretise(selected).kind());
		assertEquals(Kind.OBJECT, Types.unwrap(selected).kind());
	}

	@Test
	void emptySelect_respectedByAnything() {
		var result = Retrieve.isRespected(RetrieveFixtures.USER, Map.of("select", Map.of()), Map.of("name", "Ada"));
		assertEquals(Map.of(), result.value());
	}

	@Test
	void selectedField_isRequired() {
		var retrieve = Map.of("select", Map.of("name", true));
		assertEquals(Map.of("name", "Ada"),
			Retrieve.isRespected(RetrieveFixtures.USER, retrieve, Map.of("name", "Ada", "posts", List.of())).value());
		var missing = Retrieve.isRespected(RetrieveFixtures.USER, retrieve, Map.of("posts", List.of()));
		assertEquals(Path.ofField("name"), missing.error().get(0).path());
	}

	@Test
	void relationWithoutNestedSelect_isOmitted() {
		var retrieve = Map.of("select", Map.of("name", true, "posts", Map.of()));
		assertEquals(Map.of("name", "Ada"),
			Retrieve.isRespected(RetrieveFixtures.USER, retrieve, Map.of("name", "Ada")).value());
	}

	@Test
	void relationWithNestedSelect_isTrimmed() {
		var retrieve = Map.of("select", Map.of("posts", Map.of("select", Map.of("title", true))));
		var value = Map.of("posts", List.of(post("Hello"), post("World")));
		assertEquals(
			Map.of("posts", List.of(Map.of("title", "Hello"), Map.of("title", "World"))),
			Retrieve.isRespected(RetrieveFixtures.USER, retrieve, value).value());

		var emptySelect = Map.of("select", Map.of("posts", Map.of("select", Map.of())));
		assertEquals(
			Map.of("posts", List.of(Map.of())),
			Retrieve.isRespected(RetrieveFixtures.USER, emptySelect, Map.of("posts", List.of(post("Hello")))).value());
		assertTrue(Retrieve.isRespected(RetrieveFixtures.USER, emptySelect, Map.of()).isFailure());
	}

	@Test
	void embeddedObjectSelectedWhole_requiresAllFields() {
		var retrieve = Map.of("select", Map.of("metadata", true));
		var respected = Retrieve.isRespected(RetrieveFixtures.USER, retrieve, Map.of("metadata", metadata()));
		assertEquals(
			Map.of("metadata", Map.of(
				"registeredAt", Instant.parse(REGISTERED),
				"loggedInAt", Instant.parse(REGISTERED))),
			respected.value());

		var partial = Retrieve.isRespected(RetrieveFixtures.USER, retrieve, Map.of("metadata", Map.of("registeredAt", REGISTERED)));
		assertEquals(Path.ofField("metadata").appendField("loggedInAt"), partial.error().get(0).path());
	}

	@Test
	void noRetrieve_respectsWholeType() {
		var value = Map.of("name", "Ada", "posts", List.of(), "metadata", metadata());
		assertTrue(Retrieve.isRespected(RetrieveFixtures.USER, null, value).isOk());
		assertTrue(Retrieve.isRespected(RetrieveFixtures.USER, null, Map.of("name", "Ada")).isFailure());
	}

	static Stream<Arguments> selectionDepths() {
		return Stream.of(
			arguments(null, 1),
			arguments(Map.of(), 1),
			arguments(Map.of("select", Map.of()), 1),
			arguments(Map.of("select", Map.of("name", true, "metadata", true)), 1),
			arguments(Map.of("select", Map.of("bestFriend", true)), 2),
			arguments(Map.of("select", Map.of("posts", true)), 2),
			arguments(Map.of("select", Map.of("posts", Map.of())), 2),
			arguments(Map.of("select", Map.of("posts", Map.of("select", Map.of("title", true)))), 2),
			arguments(Map.of("select", Map.of("posts", Map.of("select", Map.of("author", true)))), 3),
			arguments(Map.of("select", Map.of(
				"bestFriend", Map.of("select", Map.of("bestFriend", Map.of("select", Map.of("name", true)))))), 3)
		);
	}

	@ParameterizedTest
	@MethodSource("selectionDepths")
	void selectionDepth(Map<String, ?> retrieve, int expected) {
		assertEquals(expected, Retrieve.selectionDepth(RetrieveFixtures.USER, retrieve));
	}

	@Test
	void selectionDepth_nonEntity() {
		assertEquals(1, Retrieve.selectionDepth(string(), Map.of("select", Map.of("x", true))));
	}

	@Test
	void sortDirection_isAscOrDesc() {
		assertTrue(Strata.decode(Retrieve.sortDirection(), "asc").isOk());
		assertTrue(Strata.decode(Retrieve.sortDirection(), "up").isFailure());
	}
}
