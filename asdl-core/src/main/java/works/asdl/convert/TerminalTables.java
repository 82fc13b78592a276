package works.asdl.convert;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;

/**
 * The {@link TerminalTable}s for a language, keyed by field type name.
 */
public final class TerminalTables {
	private final Map<String, TerminalTable> tablesByType;

	private TerminalTables(Map<String, TerminalTable> tablesByType) {
		this.tablesByType = unmodifiableMap(new LinkedHashMap<>(tablesByType));
	}

	public static TerminalTables empty() {
		return new TerminalTables(Map.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @throws IllegalArgumentException if there's no table for {@code fieldType}
	 */
	public TerminalTable table(String fieldType) {
		TerminalTable result = tablesByType.get(fieldType);
		if (result == null) {
			throw new IllegalArgumentException("No terminal table for " + fieldType);
		}
		return result;
	}

	public boolean has(String fieldType) {
		return tablesByType.containsKey(fieldType);
	}

	public Set<String> fieldTypes() {
		return tablesByType.keySet();
	}

	public Collection<TerminalTable> tables() {
		return tablesByType.values();
	}

	public static final class Builder {
		private final Map<String, TerminalTable> tablesByType = new LinkedHashMap<>();

		Builder() {}

		public Builder table(TerminalTable table) {
			if (tablesByType.putIfAbsent(table.fieldType(), table) != null) {
				throw new IllegalArgumentException("Duplicate terminal table for " + table.fieldType());
			}
			return this;
		}

		public TerminalTables build() {
			return new TerminalTables(tablesByType);
		}
	}
}
