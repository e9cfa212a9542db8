/*-
 * #%L
 * This file is part of TEM Nanocrystals.
 * %%
 * Copyright (C) 2024 TEM Nanocrystals developers
 * %%
 * TEM Nanocrystals is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TEM Nanocrystals is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TEM Nanocrystals.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temnano.lib.common;

import java.util.Locale;

/**
 * A collection of generally useful static methods.
 */
public class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Format a value with a number of significant figures, in the manner of C's {@code %g}
	 * but without trailing zeros or an exponent for moderate values.
	 * @param value
	 * @param significantFigures
	 * @return
	 */
	public static String formatSignificant(double value, int significantFigures) {
		if (!Double.isFinite(value))
			return Double.toString(value);
		if (value == 0)
			return "0";
		double magnitude = Math.floor(Math.log10(Math.abs(value)));
		if (magnitude < -4 || magnitude >= significantFigures)
			return String.format(Locale.US, "%." + (significantFigures-1) + "e", value);
		int decimals = (int)Math.max(0, significantFigures - 1 - magnitude);
		String s = String.format(Locale.US, "%." + decimals + "f", value);
		if (s.contains(".")) {
			s = s.replaceAll("0+$", "");
			if (s.endsWith("."))
				s = s.substring(0, s.length()-1);
		}
		return s;
	}

	/**
	 * Check if a string is null or blank.
	 * @param s
	 * @param trim if true, whitespace is trimmed before checking
	 * @return
	 */
	public static boolean blankString(final String s, final boolean trim) {
		if (s == null)
			return true;
		return trim ? s.trim().isEmpty() : s.isEmpty();
	}

}
