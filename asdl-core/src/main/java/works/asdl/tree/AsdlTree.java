package works.asdl.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import works.asdl.exceptions.MalformedTreeException;
import works.asdl.grammar.Field;
import works.asdl.grammar.Production;

import static java.util.Objects.requireNonNull;

/**
 * A grammar-typed tree node: a {@link Production} and one {@link RealizedField}
 * per production field, in declared order.
 * <p>
 * Trees are immutable and compare structurally.
 */
public final class AsdlTree implements AsdlValue {
	private final Production production;
	private final List<RealizedField> fields;

	/**
	 * @throws MalformedTreeException if {@code fields} does not line up one-to-one,
	 * in order, with the fields of {@code production}
	 */
	public AsdlTree(Production production, List<RealizedField> fields) {
		this.production = requireNonNull(production);
		this.fields = List.copyOf(fields);
		List<Field> expected = production.fields();
		if (this.fields.size() != expected.size()) {
			throw new MalformedTreeException("Production " + production.constructorName()
				+ " has " + expected.size() + " fields; tree has " + this.fields.size());
		}
		for (int i = 0; i < expected.size(); i++) {
			Field actual = this.fields.get(i).field();
			if (!actual.equals(expected.get(i))) {
				throw new MalformedTreeException("Field " + i + " of " + production.constructorName()
					+ " should be " + expected.get(i) + "; found " + actual);
			}
		}
	}

	/**
	 * @return a tree whose fields are all empty
	 */
	public static AsdlTree of(Production production) {
		List<RealizedField> fields = new ArrayList<>(production.fields().size());
		production.fields().forEach(f -> fields.add(RealizedField.empty(f)));
		return new AsdlTree(production, fields);
	}

	public static AsdlTree of(Production production, RealizedField... fields) {
		return new AsdlTree(production, List.of(fields));
	}

	public Production production() {
		return production;
	}

	public String constructorName() {
		return production.constructorName();
	}

	public List<RealizedField> fields() {
		return fields;
	}

	/**
	 * @throws IllegalArgumentException if the production has no such field
	 */
	public RealizedField field(String name) {
		for (RealizedField f: fields) {
			if (f.name().equals(name)) {
				return f;
			}
		}
		throw new IllegalArgumentException("Production " + production.constructorName() + " has no field " + name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AsdlTree other)) {
			return false;
		}
		return production.equals(other.production) && fields.equals(other.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production, fields);
	}

	/**
	 * @return an S-expression like {@code (BinaryOp (op (Add)) (left (ID (name (IdentToken (token "x"))))) ...)}
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(").append(production.constructorName());
		fields.forEach(f -> sb.append(' ').append(f));
		return sb.append(')').toString();
	}
}
