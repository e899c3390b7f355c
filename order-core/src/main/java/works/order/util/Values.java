package works.order.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Small conversions used by parsers that accept either one value or many.
 */
public final class Values {
	private Values() { }

	/**
	 * @return a new list holding the elements of {@code raw} if it is a collection or array,
	 *   or holding {@code raw} itself otherwise
	 */
	public static List<Object> asList(Object raw) {
		List<Object> result = new ArrayList<>();
		if (raw instanceof Collection<?> c) {
			result.addAll(c);
		} else if (raw != null && raw.getClass().isArray()) {
			int length = Array.getLength(raw);
			for (int i = 0; i < length; i++) {
				result.add(Array.get(raw, i));
			}
		} else {
			result.add(raw);
		}
		return result;
	}

	public static boolean isSequence(Object raw) {
		return raw instanceof Collection<?> || (raw != null && raw.getClass().isArray());
	}

	/**
	 * Prints the shortest decimal that reads back as {@code value}.
	 * Magnitudes from {@code 1e-4} up to {@code 1e16} are written out in full and always carry
	 * a fraction, as in {@code "0.5"} or {@code "10000000.0"}; others use an exponent with
	 * a sign and at least two digits, as in {@code "1e+16"} or {@code "2.5e-05"}.
	 */
	public static String formatDecimal(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		} else if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		} else if (value == 0) {
			return (1 / value < 0) ? "-0.0" : "0.0";
		}
		BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
		int exponent = decimal.precision() - decimal.scale() - 1;
		if (exponent >= -4 && exponent < 16) {
			String plain = decimal.toPlainString();
			return plain.indexOf('.') < 0 ? plain + ".0" : plain;
		}
		String digits = decimal.unscaledValue().abs().toString();
		String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
		return (value < 0 ? "-" : "") + mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
	}
}
