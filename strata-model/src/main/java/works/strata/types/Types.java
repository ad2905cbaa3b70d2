package works.strata.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import works.strata.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Factory methods for every kind of {@link Type}, plus the operations that
 * see through {@link LazyType lazy} indirections.
 * <p>
 * Intended to be imported statically.
 */
public final class Types {
	private Types() { }

	public static StringType string() {
		return new StringType(StringOptions.NONE);
	}

	public static StringType string(StringOptions options) {
		return new StringType(options);
	}

	public static NumberType number() {
		return new NumberType(NumberOptions.NONE);
	}

	public static NumberType number(NumberOptions options) {
		return new NumberType(options);
	}

	public static NumberType integer() {
		return new NumberType(NumberOptions.INTEGER);
	}

	/**
	 * @param options {@link NumberOptions#isInteger()} is forced to true
	 */
	public static NumberType integer(NumberOptions options) {
		return new NumberType(options.toBuilder().isInteger(true).build());
	}

	public static BooleanType bool() {
		return new BooleanType(BasicOptions.NONE);
	}

	public static BooleanType bool(BasicOptions options) {
		return new BooleanType(options);
	}

	public static LiteralType literal(Object value) {
		return literal(value, BasicOptions.NONE);
	}

	/**
	 * @param value any {@link Number} is normalized to a {@link Long} or {@link Double}
	 */
	public static LiteralType literal(Object value, BasicOptions options) {
		return new LiteralType(normalizeNumber(value), options);
	}

	public static EnumType enumeration(String... variants) {
		return new EnumType(Arrays.asList(variants), BasicOptions.NONE);
	}

	public static EnumType enumeration(List<String> variants, BasicOptions options) {
		return new EnumType(variants, options);
	}

	public static Members members() {
		return new Members();
	}

	public static ObjectType object(Members fields) {
		return object(fields.toMap(), BasicOptions.NONE);
	}

	public static ObjectType object(Members fields, BasicOptions options) {
		return object(fields.toMap(), options);
	}

	public static ObjectType object(Map<String, ? extends Type> fields, BasicOptions options) {
		return new ObjectType(Members.checkedCopy(fields, "field"), Mutability.IMMUTABLE, options);
	}

	public static ObjectType mutableObject(Members fields) {
		return new ObjectType(fields.toMap(), Mutability.MUTABLE, BasicOptions.NONE);
	}

	public static EntityType entity(Members fields) {
		return entity(fields.toMap(), BasicOptions.NONE);
	}

	public static EntityType entity(Members fields, BasicOptions options) {
		return entity(fields.toMap(), options);
	}

	public static EntityType entity(Map<String, ? extends Type> fields, BasicOptions options) {
		return new EntityType(Members.checkedCopy(fields, "field"), Mutability.IMMUTABLE, options);
	}

	public static ArrayType array(Type items) {
		return new ArrayType(items, Mutability.IMMUTABLE, ArrayOptions.NONE);
	}

	public static ArrayType array(Type items, ArrayOptions options) {
		return new ArrayType(items, Mutability.IMMUTABLE, options);
	}

	public static ArrayType mutableArray(Type items) {
		return new ArrayType(items, Mutability.MUTABLE, ArrayOptions.NONE);
	}

	public static OptionalType optional(Type wrapped) {
		return new OptionalType(wrapped, BasicOptions.NONE);
	}

	public static NullableType nullable(Type wrapped) {
		return new NullableType(wrapped, BasicOptions.NONE);
	}

	public static ReferenceType reference(Type wrapped) {
		return new ReferenceType(wrapped, BasicOptions.NONE);
	}

	public static UnionType union(Members variants) {
		return new UnionType(variants.toMap(), BasicOptions.NONE);
	}

	public static UnionType union(Members variants, BasicOptions options) {
		return new UnionType(variants.toMap(), options);
	}

	public static UnionType union(Map<String, ? extends Type> variants, BasicOptions options) {
		return new UnionType(Members.checkedCopy(variants, "variant"), options);
	}

	public static <O> CustomType<O> custom(String typeName, CustomBehaviour<O> behaviour, O customOptions) {
		return new CustomType<>(typeName, behaviour, customOptions, BasicOptions.NONE);
	}

	public static <O> CustomType<O> custom(String typeName, CustomBehaviour<O> behaviour, O customOptions, BasicOptions options) {
		return new CustomType<>(typeName, behaviour, customOptions, options);
	}

	public static LazyType lazy(Supplier<? extends Type> producer) {
		return new LazyType(producer);
	}

	public static ConcreteType concretise(Type type) {
		if (type instanceof ConcreteType concrete) {
			return concrete;
		} else {
			return ((LazyType) requireNonNull(type)).concretise();
		}
	}

	public static boolean areEqual(Type t1, Type t2) {
		return new TypeEquality().areEqual(t1, t2);
	}

	public static boolean isOptional(Type type) {
		return concretise(type).kind() == Kind.OPTIONAL;
	}

	/**
	 * Strips every {@link WrapperType wrapper}, including arrays.
	 */
	public static ConcreteType unwrap(Type type) {
		ConcreteType concrete = concretise(type);
		while (concrete instanceof WrapperType wrapper) {
			concrete = concretise(wrapper.wrappedType());
		}
		return concrete;
	}

	/**
	 * Strips {@link OptionalType optional}, {@link NullableType nullable} and
	 * {@link ReferenceType reference} wrappers, but not arrays.
	 */
	public static ConcreteType unwrapField(Type type) {
		ConcreteType concrete = concretise(type);
		while (concrete instanceof WrapperType wrapper && concrete.kind() != Kind.ARRAY) {
			concrete = concretise(wrapper.wrappedType());
		}
		return concrete;
	}

	/**
	 * @return a type with the same fields, all of them {@link OptionalType optional}
	 */
	public static ObjectType partial(FieldsType type) {
		Map<String, Type> fields = new LinkedHashMap<>();
		type.fields().forEach((name, fieldType) ->
			fields.put(name, isOptional(fieldType) ? fieldType : optional(fieldType)));
		return new ObjectType(fields, type.mutability(), type.options());
	}

	public static ObjectType pick(FieldsType type, Set<String> names) {
		return restrict(type, names, true);
	}

	public static ObjectType omit(FieldsType type, Set<String> names) {
		return restrict(type, names, false);
	}

	private static ObjectType restrict(FieldsType type, Set<String> names, boolean keep) {
		for (String name: names) {
			if (!type.fields().containsKey(name)) {
				throw new InvalidTypeException("No field \"" + name + "\" in " + type.displayName());
			}
		}
		Map<String, Type> fields = new LinkedHashMap<>();
		type.fields().forEach((name, fieldType) -> {
			if (names.contains(name) == keep) {
				fields.put(name, fieldType);
			}
		});
		return new ObjectType(fields, type.mutability(), BasicOptions.NONE);
	}

	static Object normalizeNumber(Object value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof Float f) {
			return f.doubleValue();
		} else if (value instanceof BigInteger i) {
			return i.longValueExact();
		} else if (value instanceof BigDecimal d) {
			try {
				return d.longValueExact();
			} catch (ArithmeticException e) {
				return d.doubleValue();
			}
		} else {
			return value;
		}
	}
}
