package works.strata.types;

/**
 * The closed set of {@link ConcreteType} kinds.
 * Algorithms over types switch on this exhaustively,
 * so adding a kind is a compile error everywhere it needs handling.
 */
public enum Kind {
	STRING,
	NUMBER,
	BOOLEAN,
	LITERAL,
	ENUM,
	OBJECT,
	ENTITY,
	ARRAY,
	OPTIONAL,
	NULLABLE,
	REFERENCE,
	UNION,
	CUSTOM,
}
