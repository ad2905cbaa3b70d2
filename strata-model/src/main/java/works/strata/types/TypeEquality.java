package works.strata.types;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural equality that terminates on cyclic type graphs.
 * <p>
 * Equality is co-inductive: a pair of types encountered again while it's
 * still being compared is assumed equal. Each instance tracks the pairs
 * it has seen, so use a fresh one per top-level comparison.
 */
final class TypeEquality {
	private final Set<IdentityPair> visited = new HashSet<>();

	boolean areEqual(Type t1, Type t2) {
		ConcreteType c1 = Types.concretise(t1);
		ConcreteType c2 = Types.concretise(t2);
		if (c1 == c2) {
			return true;
		}
		if (!visited.add(new IdentityPair(c1, c2))) {
			return true;
		}
		if (c1.kind() != c2.kind() || !c1.options().equals(c2.options())) {
			return false;
		}
		return switch (c1.kind()) {
			case STRING, NUMBER, BOOLEAN -> true;
			case LITERAL -> Objects.equals(((LiteralType) c1).value(), ((LiteralType) c2).value());
			case ENUM -> ((EnumType) c1).variants().equals(((EnumType) c2).variants());
			case OBJECT, ENTITY -> {
				FieldsType f1 = (FieldsType) c1;
				FieldsType f2 = (FieldsType) c2;
				yield f1.mutability() == f2.mutability() && membersEqual(f1.fields(), f2.fields());
			}
			case ARRAY -> ((ArrayType) c1).mutability() == ((ArrayType) c2).mutability()
				&& areEqual(((ArrayType) c1).wrappedType(), ((ArrayType) c2).wrappedType());
			case OPTIONAL, NULLABLE, REFERENCE -> areEqual(((WrapperType) c1).wrappedType(), ((WrapperType) c2).wrappedType());
			case UNION -> membersEqual(((UnionType) c1).variants(), ((UnionType) c2).variants());
			case CUSTOM -> {
				CustomType<?> x1 = (CustomType<?>) c1;
				CustomType<?> x2 = (CustomType<?>) c2;
				yield x1.typeName().equals(x2.typeName())
					&& x1.behaviour() == x2.behaviour()
					&& Objects.equals(x1.customOptions(), x2.customOptions());
			}
		};
	}

	/**
	 * Member order is significant.
	 */
	private boolean membersEqual(Map<String, Type> m1, Map<String, Type> m2) {
		if (m1.size() != m2.size()) {
			return false;
		}
		Iterator<Map.Entry<String, Type>> i1 = m1.entrySet().iterator();
		Iterator<Map.Entry<String, Type>> i2 = m2.entrySet().iterator();
		while (i1.hasNext()) {
			var e1 = i1.next();
			var e2 = i2.next();
			if (!e1.getKey().equals(e2.getKey()) || !areEqual(e1.getValue(), e2.getValue())) {
				return false;
			}
		}
		return true;
	}

	private record IdentityPair(ConcreteType first, ConcreteType second) {
		@Override
		public boolean equals(Object obj) {
			return obj instanceof IdentityPair other && first == other.first && second == other.second;
		}

		@Override
		public int hashCode() {
			return 31 * System.identityHashCode(first) + System.identityHashCode(second);
		}
	}
}
