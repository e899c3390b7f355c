package works.order.util;

import java.util.regex.Pattern;

/**
 * The pattern languages understood by {@link Patterns}.
 */
public enum PatternSyntax {
	/**
	 * Shell-style wildcards ({@code *}, {@code ?}, {@code [seq]}, {@code [!seq]}) matching the whole name.
	 * Case-sensitive, as shell globbing is on POSIX systems.
	 */
	GLOB,

	/**
	 * Same as {@link #GLOB}; kept distinct so callers can state that they rely on case sensitivity.
	 */
	GLOB_CASE,

	/**
	 * Java regular expressions anchored at the start of the name but not at the end.
	 */
	REGEX;

	Pattern compile(String pattern) {
		return switch (this) {
			case GLOB, GLOB_CASE -> Pattern.compile(Patterns.globToRegex(pattern), Pattern.DOTALL);
			case REGEX -> Pattern.compile(pattern);
		};
	}

	boolean matches(Pattern compiled, String name) {
		return switch (this) {
			case GLOB, GLOB_CASE -> compiled.matcher(name).matches();
			case REGEX -> compiled.matcher(name).lookingAt();
		};
	}
}
