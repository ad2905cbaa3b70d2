package works.strata.retrieve;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.strata.retrieve.MergeOptions.Order;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetrieveMergerTest {

	static Map<String, Object> merge(Map<String, ?> left, Map<String, ?> right) {
		return Retrieve.merge(RetrieveFixtures.USER, left, right);
	}

	@Test
	void missingSide_yieldsTheOther() {
		assertEquals(Map.of("take", 1), Retrieve.merge(RetrieveFixtures.USER, null, Map.of("take", 1)));
		assertEquals(Map.of("take", 1), Retrieve.merge(RetrieveFixtures.USER, Map.of("take", 1), null));
		assertNull(Retrieve.merge(RetrieveFixtures.USER, null, null));
	}

	@Test
	void where_combinedWithAnd() {
		var left = Map.of("where", Map.of("name", Map.of("equals", "Ada")));
		var right = Map.of("where", Map.of("name", Map.of("in", List.of("Ada", "Grace"))));
		assertEquals(
			Map.of("where", Map.of("AND", List.of(left.get("where"), right.get("where")))),
			merge(left, right));
	}

	@Test
	void where_oneSided() {
		var where = Map.of("name", Map.of("equals", "Ada"));
		assertEquals(
			Map.of("where", where, "select", Map.of("name", true)),
			merge(Map.of("where", where), Map.of("select", Map.of("name", true))));
	}

	@Test
	void where_emptySideIsIgnored() {
		var where = Map.of("name", Map.of("equals", "Ada"));
		assertEquals(Map.of("where", where), merge(Map.of("where", Map.of()), Map.of("where", where)));
		assertEquals(Map.of("where", where), merge(Map.of("where", where), Map.of("where", Map.of())));
		assertEquals(Map.of(), merge(Map.of("where", Map.of()), Map.of("where", Map.of())));
	}

	@Test
	void select_unitesFields() {
		var postsRetrieve = Map.of(
			"where", Map.of("title", Map.of("equals", "Hello")),
			"select", Map.of("title", true));
		assertEquals(
			Map.of("select", Map.of("name", true, "posts", postsRetrieve)),
			merge(
				Map.of("select", Map.of("name", true)),
				Map.of("select", Map.of("posts", postsRetrieve))));
	}

	@Test
	void select_falseIsNotSelected() {
		assertEquals(
			Map.of("select", Map.of("name", true)),
			merge(
				Map.of("select", Map.of("name", false)),
				Map.of("select", Map.of("name", true))));
	}

	@Test
	void relationSelectedWholeOnBothSides_staysWhole() {
		assertEquals(
			Map.of("select", Map.of("posts", true)),
			merge(
				Map.of("select", Map.of("posts", true)),
				Map.of("select", Map.of("posts", true))));
	}

	@Test
	void relationSelectedWhole_expandsToNonRelationFields() {
		assertEquals(
			Map.of("select", Map.of("posts", Map.of("select", Map.of("title", true, "content", true, "tags", true)))),
			merge(
				Map.of("select", Map.of("posts", true)),
				Map.of("select", Map.of("posts", Map.of()))));
	}

	@Test
	void relationSelectedWhole_keepsOtherSideRelations() {
		assertEquals(
			Map.of("select", Map.of("posts", Map.of("select", Map.of(
				"title", true,
				"content", true,
				"author", true,
				"tags", true)))),
			merge(
				Map.of("select", Map.of("posts", Map.of("select", Map.of("author", true)))),
				Map.of("select", Map.of("posts", true))));
	}

	@Test
	void toOneRelation_expandsToNonRelationFields() {
		assertEquals(
			Map.of("select", Map.of("author", Map.of("select", Map.of("name", true, "metadata", true)))),
			Retrieve.merge(RetrieveFixtures.POST,
				Map.of("select", Map.of("author", true)),
				Map.of("select", Map.of("author", Map.of()))));
	}

	@Test
	void embeddedObject_mergesDeeply() {
		assertEquals(
			Map.of("select", Map.of("metadata", Map.of("select", Map.of("registeredAt", true, "loggedInAt", true)))),
			merge(
				Map.of("select", Map.of("metadata", Map.of("select", Map.of("registeredAt", true)))),
				Map.of("select", Map.of("metadata", Map.of("select", Map.of("loggedInAt", true))))));
		assertEquals(
			Map.of("select", Map.of("metadata", true)),
			merge(
				Map.of("select", Map.of("metadata", Map.of("select", Map.of("registeredAt", true)))),
				Map.of("select", Map.of("metadata", true))));
		assertEquals(
			Map.of("select", Map.of("metadata", Map.of())),
			merge(
				Map.of("select", Map.of("metadata", Map.of())),
				Map.of("select", Map.of("metadata", Map.of()))));
	}

	@Test
	void orderBy_concatenated() {
		var byName = Map.of("name", "asc");
		var byPosts = Map.of("posts", Map.of("_count", "desc"));
		var left = Map.of("orderBy", List.of(byName));
		var right = Map.of("orderBy", byPosts);
		assertEquals(Map.of("orderBy", List.of(byName, byPosts)), merge(left, right));
		assertEquals(
			Map.of("orderBy", List.of(byPosts, byName)),
			Retrieve.merge(RetrieveFixtures.USER, left, right, MergeOptions.DEFAULT.withOrderByOrder(Order.RIGHT_BEFORE)));
	}

	@Test
	void skipAndTake_fromFirstSideThatHasThem() {
		var left = Map.of("skip", 1);
		var right = Map.of("skip", 2, "take", 3);
		assertEquals(Map.of("skip", 1, "take", 3), merge(left, right));
		assertEquals(
			Map.of("skip", 2, "take", 3),
			Retrieve.merge(RetrieveFixtures.USER, left, right, MergeOptions.of(Order.RIGHT_BEFORE)));
		assertEquals(
			Map.of("skip", 2, "take", 3),
			Retrieve.merge(RetrieveFixtures.USER, left, right, MergeOptions.builder()
				.orderByOrder(Order.LEFT_BEFORE)
				.skipOrder(Order.RIGHT_BEFORE)
				.takeOrder(Order.LEFT_BEFORE)
				.build()));
	}

	@Test
	void result_isUnmodifiable() {
		var result = merge(Map.of("take", 1), Map.of("skip", 1));
		assertThrows(UnsupportedOperationException.class, () -> result.put("take", 2));
	}
}
