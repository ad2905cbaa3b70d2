package works.strata.types;

import java.util.Map;

/**
 * A type whose values are records with a fixed set of named fields.
 * {@link EntityType} differs from {@link ObjectType} only in that its values have identity,
 * which matters to collaborators like the retrieve deriver.
 */
public sealed interface FieldsType extends ConcreteType permits ObjectType, EntityType {
	/**
	 * In declaration order.
	 */
	Map<String, Type> fields();

	Mutability mutability();

	@Override
	BasicOptions options();
}
