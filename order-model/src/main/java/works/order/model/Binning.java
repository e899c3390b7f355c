package works.order.model;

import java.util.List;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.InvalidValueException;
import works.order.util.Values;

/**
 * Equidistant histogram binning: {@code nBins} bins between {@code min} and {@code max}.
 */
public record Binning(int nBins, double min, double max) {
	public Binning {
		if (nBins <= 0) {
			throw new InvalidValueException("binning must have a positive number of bins: " + nBins);
		}
	}

	public static Binning of(int nBins, double min, double max) {
		return new Binning(nBins, min, max);
	}

	public double binWidth() {
		return (max - min) / nBins;
	}

	/**
	 * Accepts a {@link Binning}, or a collection or array of three numbers
	 * {@code (nBins, min, max)} where {@code nBins} is integral.
	 *
	 * @throws InvalidTypeException if {@code raw} is not a sequence of numbers
	 * @throws InvalidValueException if {@code raw} doesn't have three elements,
	 *   or {@code nBins} is not between 1 and {@link Integer#MAX_VALUE}
	 */
	public static Binning parse(Object raw) {
		if (raw instanceof Binning binning) {
			return binning;
		} else if (!Values.isSequence(raw)) {
			throw InvalidTypeException.of("binning", raw);
		}
		List<Object> elements = Values.asList(raw);
		if (elements.size() != 3) {
			throw new InvalidValueException("binning must have length 3: " + elements);
		}
		for (Object element : elements) {
			if (!(element instanceof Number)) {
				throw InvalidTypeException.of("binning element", element);
			}
		}
		double nBins = ((Number) elements.get(0)).doubleValue();
		if (Double.isNaN(nBins) || Double.isInfinite(nBins) || nBins != Math.rint(nBins)) {
			throw new InvalidValueException("number of bins must be integral: " + elements.get(0));
		} else if (nBins < 1 || nBins > Integer.MAX_VALUE) {
			throw new InvalidValueException("number of bins out of range: " + elements.get(0));
		}
		return new Binning((int) nBins, ((Number) elements.get(1)).doubleValue(), ((Number) elements.get(2)).doubleValue());
	}

	@Override
	public String toString() {
		return "(" + nBins + ", " + min + ", " + max + ")";
	}
}
