package edu.isi.hyperkbest;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Rounds scores for printing. Formatting is locale-independent, so n-best
 * files look the same everywhere.
 */
public class Rounding {

	private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

	/**
	 * Round a double value to a specified number of decimal places. Values too
	 * small to show at that precision come out in scientific notation instead of
	 * as zero; infinities and NaN print as Java prints them.
	 *
	 * @param val the value to be rounded.
	 * @param places the number of decimal places to round to.
	 * @return string version of val rounded to places decimal places.
	 */
	public static String round(double val, int places) {
		if (Double.isNaN(val) || Double.isInfinite(val))
			return Double.toString(val);
		if (val == 0.0)
			return "0.0";
		StringBuilder lpattern = new StringBuilder("0.");
		StringBuilder spattern = new StringBuilder("0.");
		for (int i = 0; i < places; i++) {
			lpattern.append('0');
			spattern.append('#');
		}
		spattern.append("E0");
		if (Math.abs(val) < Math.pow(10, -places))
			return new DecimalFormat(spattern.toString(), SYMBOLS).format(val);
		return new DecimalFormat(lpattern.toString(), SYMBOLS).format(val);
	}
}
