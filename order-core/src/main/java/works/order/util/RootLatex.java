package works.order.util;

/**
 * Converts LaTeX-ish text, as written in titles and labels, into the dialect understood by ROOT's TLatex.
 * Text without markup passes through unchanged.
 */
public final class RootLatex {
	private RootLatex() { }

	public static String convert(String text) {
		if (text == null) {
			return null;
		}
		return text
			.replace("$", "")
			.replace("\\,", "")
			.replace("\\;", "")
			.replace('~', ' ')
			.replace("\\{", "{")
			.replace("\\}", "}")
			.replace('\\', '#');
	}
}
