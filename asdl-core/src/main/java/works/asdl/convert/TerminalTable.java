package works.asdl.convert;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import works.asdl.exceptions.UnknownTerminalException;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Maps the native lexical tokens of one terminal field type
 * (like {@code "+="}) to and from zero-field grammar constructors (like {@code AddAssign}).
 * <p>
 * Normally the mapping is one-to-one, and the reverse direction is the inverse of the forward direction.
 * A table may instead map several tokens to the same constructor,
 * in which case each such constructor needs a {@link Builder#canonical canonical} token
 * to decode to. Decoding then preserves only the token's class, not its spelling.
 */
public final class TerminalTable {
	private final String fieldType;
	private final Map<String, String> constructorsByToken;
	private final Map<String, String> tokensByConstructor;

	private TerminalTable(String fieldType, Map<String, String> constructorsByToken, Map<String, String> tokensByConstructor) {
		this.fieldType = fieldType;
		this.constructorsByToken = unmodifiableMap(new LinkedHashMap<>(constructorsByToken));
		this.tokensByConstructor = unmodifiableMap(new LinkedHashMap<>(tokensByConstructor));
	}

	public static Builder builder(String fieldType) {
		return new Builder(fieldType);
	}

	public String fieldType() {
		return fieldType;
	}

	/**
	 * @throws UnknownTerminalException if {@code token} has no entry
	 */
	public String constructorFor(String token) {
		String result = constructorsByToken.get(token);
		if (result == null) {
			throw UnknownTerminalException.unknownToken(fieldType, token);
		}
		return result;
	}

	/**
	 * @throws UnknownTerminalException if {@code constructorName} has no entry
	 */
	public String tokenFor(String constructorName) {
		String result = tokensByConstructor.get(constructorName);
		if (result == null) {
			throw UnknownTerminalException.unknownConstructor(fieldType, constructorName);
		}
		return result;
	}

	/**
	 * @return native tokens in the order they were added
	 */
	public Set<String> tokens() {
		return constructorsByToken.keySet();
	}

	public Set<String> constructors() {
		return tokensByConstructor.keySet();
	}

	public boolean isBijective() {
		return constructorsByToken.size() == tokensByConstructor.size();
	}

	@Override
	public String toString() {
		return "TerminalTable(" + fieldType + ", " + constructorsByToken + ")";
	}

	public static final class Builder {
		private final String fieldType;
		private final Map<String, String> constructorsByToken = new LinkedHashMap<>();
		private final Map<String, String> canonicalTokens = new LinkedHashMap<>();

		Builder(String fieldType) {
			this.fieldType = requireNonNull(fieldType);
		}

		public Builder map(String token, String constructorName) {
			String existing = constructorsByToken.putIfAbsent(requireNonNull(token), requireNonNull(constructorName));
			if (existing != null) {
				throw new IllegalArgumentException(fieldType + " token \"" + token + "\" is already mapped to " + existing);
			}
			return this;
		}

		/**
		 * Declares the token that {@code constructorName} decodes to
		 * when more than one token maps to it.
		 */
		public Builder canonical(String constructorName, String token) {
			canonicalTokens.put(requireNonNull(constructorName), requireNonNull(token));
			return this;
		}

		/**
		 * @throws IllegalStateException if a constructor has several tokens and no canonical token,
		 * or a canonical token does not map to its constructor
		 */
		public TerminalTable build() {
			Map<String, String> reverse = new LinkedHashMap<>();
			Map<String, Integer> tokenCounts = new LinkedHashMap<>();
			constructorsByToken.forEach((token, ctor) -> {
				tokenCounts.merge(ctor, 1, Integer::sum);
				reverse.putIfAbsent(ctor, token);
			});
			canonicalTokens.forEach((ctor, token) -> {
				if (!ctor.equals(constructorsByToken.get(token))) {
					throw new IllegalStateException(fieldType + " canonical token \"" + token + "\" does not map to " + ctor);
				}
				reverse.put(ctor, token);
			});
			tokenCounts.forEach((ctor, count) -> {
				if (count > 1 && !canonicalTokens.containsKey(ctor)) {
					throw new IllegalStateException(fieldType + " constructor " + ctor + " has " + count + " tokens but no canonical token");
				}
			});
			return new TerminalTable(fieldType, constructorsByToken, reverse);
		}
	}
}
