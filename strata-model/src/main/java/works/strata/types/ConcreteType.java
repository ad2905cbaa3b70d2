package works.strata.types;

public sealed interface ConcreteType extends Type
	permits StringType, NumberType, BooleanType, LiteralType, EnumType, FieldsType, WrapperType, UnionType, CustomType {

	Kind kind();

	TypeOptions options();

	/**
	 * @return the user-assigned name if there is one; otherwise a name describing the kind
	 */
	default String displayName() {
		String name = options().name();
		return name == null ? kind().name().toLowerCase() : name;
	}
}
