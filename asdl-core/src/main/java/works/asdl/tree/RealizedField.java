package works.asdl.tree;

import java.util.List;
import works.asdl.grammar.Field;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Field} as it appears on a particular {@link AsdlTree}, with its values in order.
 * <p>
 * The number of values is not checked against {@link Field#cardinality()} here,
 * so that trees from untrusted producers can be represented and then rejected by the decoder.
 * Use {@link #satisfiesCardinality()} to check.
 */
public record RealizedField(
	Field field,
	List<AsdlValue> values
) {
	public RealizedField {
		requireNonNull(field);
		values = List.copyOf(values);
	}

	public static RealizedField empty(Field field) {
		return new RealizedField(field, List.of());
	}

	public static RealizedField of(Field field, AsdlValue... values) {
		return new RealizedField(field, List.of(values));
	}

	public String name() {
		return field.name();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public int size() {
		return values.size();
	}

	public boolean satisfiesCardinality() {
		return field.cardinality().admits(values.size());
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(").append(field.name());
		values.forEach(v -> sb.append(' ').append(v));
		return sb.append(')').toString();
	}
}
