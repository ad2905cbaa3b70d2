package works.strata.types;

import java.util.Map;

import static java.util.Objects.requireNonNull;

public record ObjectType(Map<String, Type> fields, Mutability mutability, BasicOptions options) implements FieldsType {
	public ObjectType {
		fields = Members.checkedCopy(fields, "field");
		requireNonNull(mutability);
		requireNonNull(options);
	}

	@Override
	public Kind kind() {
		return Kind.OBJECT;
	}

	@Override
	public String toString() {
		return "ObjectType[" + displayName() + fields.keySet() + "]";
	}
}
