package works.asdl.grammar;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * One alternative of a grammar type: a constructor name and its ordered fields.
 *
 * @param type the name of the type this production belongs to
 * @param constructorName unique within a {@link Grammar}
 */
public record Production(
	String type,
	String constructorName,
	List<Field> fields
) {
	public Production {
		requireNonNull(type);
		requireNonNull(constructorName);
		fields = List.copyOf(fields);
		long distinctNames = fields.stream().map(Field::name).distinct().count();
		if (distinctNames != fields.size()) {
			throw new IllegalArgumentException("Duplicate field name in production " + constructorName);
		}
	}

	public Optional<Field> findField(String name) {
		return fields.stream()
			.filter(f -> f.name().equals(name))
			.findFirst();
	}

	public boolean hasFields() {
		return !fields.isEmpty();
	}

	@Override
	public String toString() {
		if (fields.isEmpty()) {
			return constructorName;
		} else {
			return constructorName + fields.stream()
				.map(Field::toString)
				.collect(joining(", ", "(", ")"));
		}
	}
}
