package works.order.util;

import static java.util.Objects.requireNonNull;

/**
 * Options for {@link Selections#join}.
 *
 * @param operator the operator placed between clauses, or null for the dialect's logical AND
 * @param bracket whether the joined expression is wrapped in one more pair of parentheses
 */
public record JoinOptions(String operator, boolean bracket) {
	private static final JoinOptions DEFAULTS = new JoinOptions(null, false);

	public static JoinOptions defaults() {
		return DEFAULTS;
	}

	public static JoinOptions bracketed() {
		return new JoinOptions(null, true);
	}

	public static JoinOptions operator(String operator) {
		return new JoinOptions(requireNonNull(operator), false);
	}

	public JoinOptions withBracket(boolean bracket) {
		return new JoinOptions(operator, bracket);
	}

	String operatorFor(SelectionDialect dialect) {
		return operator == null ? dialect.andOperator() : operator;
	}
}
