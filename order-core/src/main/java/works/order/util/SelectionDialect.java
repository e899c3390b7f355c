package works.order.util;

import java.util.Locale;
import works.order.exceptions.ConfigurationException;

/**
 * The expression syntaxes in which a selection can be written.
 */
public enum SelectionDialect {
	/**
	 * ROOT {@code TTree::Draw} style boolean expressions, joined with {@code &&}.
	 */
	ROOT("root", "&&"),

	/**
	 * numexpr style array expressions, joined with {@code &}.
	 */
	NUMEXPR("numexpr", "&");

	private final String modeName;
	private final String andOperator;

	SelectionDialect(String modeName, String andOperator) {
		this.modeName = modeName;
		this.andOperator = andOperator;
	}

	/**
	 * @return the lowercase name used in attribute maps, such as {@code "root"}
	 */
	public String modeName() {
		return modeName;
	}

	public String andOperator() {
		return andOperator;
	}

	/**
	 * @throws ConfigurationException if {@code modeName} names no dialect
	 */
	public static SelectionDialect fromModeName(String modeName) {
		String normalized = modeName.toLowerCase(Locale.ROOT);
		for (SelectionDialect dialect : values()) {
			if (dialect.modeName.equals(normalized)) {
				return dialect;
			}
		}
		throw new ConfigurationException("Unknown selection mode: \"" + modeName + "\"");
	}

	@Override
	public String toString() {
		return modeName;
	}
}
