package works.strata;

import works.strata.types.EntityType;
import works.strata.types.Type;
import works.strata.types.UnionType;

import static works.strata.types.Types.array;
import static works.strata.types.Types.concretise;
import static works.strata.types.Types.entity;
import static works.strata.types.Types.integer;
import static works.strata.types.Types.lazy;
import static works.strata.types.Types.members;
import static works.strata.types.Types.number;
import static works.strata.types.Types.object;
import static works.strata.types.Types.optional;
import static works.strata.types.Types.string;
import static works.strata.types.Types.union;

/**
 * Types shared by several tests.
 */
public final class Fixtures {
	private Fixtures() { }

	public static final Type USER = lazy(() -> entity(members()
		.with("name", string())
		.with("bestFriend", optional(Fixtures.USER))));

	public static EntityType user() {
		return (EntityType) concretise(USER);
	}

	public static final UnionType SHAPE = union(members()
		.with("circle", object(members().with("radius", number())))
		.with("square", object(members().with("side", number())))
		.with("label", string()));

	public static final Type TREE = lazy(() -> object(members()
		.with("value", integer())
		.with("children", array(Fixtures.TREE))));

	/**
	 * Recursive through a union only: every {@code pair} needs two more expressions.
	 */
	public static final Type EXPR = lazy(() -> union(members()
		.with("num", integer())
		.with("pair", object(members()
			.with("l", Fixtures.EXPR)
			.with("r", Fixtures.EXPR)))));
}
