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

import java.util.SplittableRandom;

/**
 * Static functions to help work with packed RGB colors.
 */
public class ColorTools {

	/**
	 * Packed RGB value for black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Packed RGB value for white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return ((255 & 0xff)<<24) +
			   ((r & 0xff)<<16) +
			   ((g & 0xff)<<8) +
			    (b & 0xff);
	}

	/**
	 * Get the red value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Get the green value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Get the blue value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}

	/**
	 * Get a display color for a segment label.
	 * <p>
	 * Label 0 (unlabeled) is always black. Other labels get a pseudo-random color that depends only on the label,
	 * so the same segment keeps its color across repeated runs and displays.
	 *
	 * @param label
	 * @return packed RGB value
	 */
	public static int labelToRGB(int label) {
		if (label == 0)
			return BLACK;
		SplittableRandom random = new SplittableRandom(label);
		int r = random.nextInt(256);
		int g = random.nextInt(256);
		int b = random.nextInt(256);
		// Avoid (near) black, which would be indistinguishable from unlabeled pixels
		if (r + g + b < 96) {
			r = 255 - r;
			g = 255 - g;
			b = 255 - b;
		}
		return packRGB(r, g, b);
	}

}
