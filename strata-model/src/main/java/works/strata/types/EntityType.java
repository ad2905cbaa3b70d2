package works.strata.types;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Like {@link ObjectType}, but denotes a record with identity.
 * Fields of entity type are relations.
 */
public record EntityType(Map<String, Type> fields, Mutability mutability, BasicOptions options) implements FieldsType {
	public EntityType {
		fields = Members.checkedCopy(fields, "field");
		requireNonNull(mutability);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.ENTITY;
	}

	@Override
	public String toString() {
		return "EntityType[" + displayName() + fields.keySet() + "]";
	}
}
