package works.order.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.util.Arrays.asList;
import static java.util.stream.Collectors.joining;

/**
 * Joins selection clauses into one expression.
 * <p>
 * Both dialects follow the same rules and differ only in their default operator:
 * <ul>
 *     <li>null and blank clauses are dropped;</li>
 *     <li>with a conjunctive operator ({@code &&}, {@code &}, {@code *}) the neutral clause {@code "1"} is dropped;</li>
 *     <li>a clause already enclosed in one balanced pair of parentheses is kept, any other clause is wrapped;</li>
 *     <li>a lone clause that is already a join of enclosed clauses, like {@code "(a) & (b)"}, is kept;</li>
 *     <li>clauses are joined with {@code " op "};</li>
 *     <li>{@link JoinOptions#bracket()} wraps the result once more;</li>
 *     <li>nothing left to join yields {@code "1"}.</li>
 * </ul>
 * Joining is pure and deterministic, and joining an already-joined expression
 * with nothing else returns it unchanged.
 */
public final class Selections {
	public static final String TRUE = "1";

	private static final Set<String> CONJUNCTIVE_OPERATORS = Set.of("&&", "&", "*");

	private Selections() { }

	public static String join(SelectionDialect dialect, String existing, String addition, JoinOptions options) {
		return join(dialect, asList(existing, addition), options);
	}

	public static String join(SelectionDialect dialect, List<String> clauses) {
		return join(dialect, clauses, JoinOptions.defaults());
	}

	public static String join(SelectionDialect dialect, List<String> clauses, JoinOptions options) {
		String op = options.operatorFor(dialect);
		boolean dropNeutral = CONJUNCTIVE_OPERATORS.contains(op);
		List<String> kept = new ArrayList<>(clauses.size());
		for (String clause : clauses) {
			if (clause == null) {
				continue;
			}
			String trimmed = clause.strip();
			if (trimmed.isEmpty() || (dropNeutral && TRUE.equals(trimmed))) {
				continue;
			}
			kept.add(trimmed);
		}
		if (kept.isEmpty()) {
			return TRUE;
		}
		String joined;
		if (kept.size() == 1 && isJoined(kept.get(0))) {
			joined = kept.get(0);
		} else {
			joined = kept.stream()
				.map(Selections::enclosed)
				.collect(joining(" " + op + " "));
		}
		return options.bracket() ? "(" + joined + ")" : joined;
	}

	static String enclosed(String clause) {
		return isEnclosed(clause) ? clause : "(" + clause + ")";
	}

	/**
	 * @return true if {@code clause} is a sequence of enclosed groups separated by operators,
	 *   such as {@code "(a > 0) && (b < 1)"}
	 */
	static boolean isJoined(String clause) {
		int i = 0;
		int n = clause.length();
		while (true) {
			if (i >= n || clause.charAt(i) != '(') {
				return false;
			}
			int close = matchingParenthesis(clause, i);
			if (close < 0) {
				return false;
			}
			i = close + 1;
			if (i == n) {
				return true;
			}
			i = skipSpaces(clause, i);
			int operatorStart = i;
			while (i < n && clause.charAt(i) != '(' && clause.charAt(i) != ')' && !Character.isWhitespace(clause.charAt(i))) {
				i++;
			}
			if (i == operatorStart || Character.isLetterOrDigit(clause.charAt(operatorStart))) {
				return false;
			}
			i = skipSpaces(clause, i);
		}
	}

	private static int skipSpaces(String s, int i) {
		while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
			i++;
		}
		return i;
	}

	/**
	 * @return the index of the parenthesis closing the one at {@code open}, or -1
	 */
	private static int matchingParenthesis(String s, int open) {
		int depth = 0;
		for (int i = open; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					return i;
				} else if (depth < 0) {
					return -1;
				}
			}
		}
		return -1;
	}

	/**
	 * @return true if the first character is an opening parenthesis whose match is the last character
	 */
	static boolean isEnclosed(String clause) {
		return !clause.isEmpty()
			&& clause.charAt(0) == '('
			&& matchingParenthesis(clause, 0) == clause.length() - 1;
	}
}
