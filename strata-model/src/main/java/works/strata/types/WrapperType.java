package works.strata.types;

/**
 * A type built around exactly one other type.
 */
public sealed interface WrapperType extends ConcreteType permits ArrayType, OptionalType, NullableType, ReferenceType {
	Type wrappedType();
}
