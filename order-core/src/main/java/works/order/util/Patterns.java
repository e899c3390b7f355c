package works.order.util;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import works.order.exceptions.ConfigurationException;

import static java.util.Objects.requireNonNull;

/**
 * Matches a name against several patterns at once.
 */
public final class Patterns {
	private Patterns() { }

	public static boolean matches(String name, String pattern) {
		return matches(name, List.of(pattern), MatchMode.ANY, PatternSyntax.GLOB);
	}

	public static boolean matches(String name, Collection<String> patterns, MatchMode mode) {
		return matches(name, patterns, mode, PatternSyntax.GLOB);
	}

	/**
	 * @return true if {@code name} matches the {@code patterns} as combined by {@code mode}
	 * @throws ConfigurationException if a pattern is not valid in the given {@code syntax}
	 */
	public static boolean matches(String name, Collection<String> patterns, MatchMode mode, PatternSyntax syntax) {
		requireNonNull(name);
		requireNonNull(syntax);
		return mode.test(patterns, pattern -> {
			Pattern compiled;
			try {
				compiled = syntax.compile(requireNonNull(pattern));
			} catch (PatternSyntaxException e) {
				throw new ConfigurationException("Invalid " + syntax + " pattern \"" + pattern + "\": " + e.getDescription(), e);
			}
			return syntax.matches(compiled, name);
		});
	}

	/**
	 * Translates a shell-style wildcard into an equivalent regular expression.
	 * An unterminated {@code [} is taken literally.
	 */
	static String globToRegex(String glob) {
		StringBuilder sb = new StringBuilder(glob.length() + 8);
		int i = 0;
		int n = glob.length();
		while (i < n) {
			char c = glob.charAt(i++);
			switch (c) {
				case '*' -> sb.append(".*");
				case '?' -> sb.append('.');
				case '[' -> {
					int j = i;
					if (j < n && glob.charAt(j) == '!') {
						j++;
					}
					if (j < n && glob.charAt(j) == ']') {
						j++;
					}
					while (j < n && glob.charAt(j) != ']') {
						j++;
					}
					if (j >= n) {
						sb.append("\\[");
					} else {
						String contents = glob.substring(i, j)
							.replace("\\", "\\\\")
							.replace("[", "\\[")
							.replace("]", "\\]")
							.replace("&", "\\&");
						i = j + 1;
						sb.append('[');
						if (contents.startsWith("!")) {
							sb.append('^').append(contents, 1, contents.length());
						} else if (contents.startsWith("^")) {
							sb.append('\\').append(contents);
						} else {
							sb.append(contents);
						}
						sb.append(']');
					}
				}
				default -> sb.append(Pattern.quote(String.valueOf(c)));
			}
		}
		return sb.toString();
	}
}
