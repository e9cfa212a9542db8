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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestColorTools {

	@Test
	public void test_packRGB() {
		int rgb = ColorTools.packRGB(10, 20, 30);
		assertEquals(10, ColorTools.red(rgb));
		assertEquals(20, ColorTools.green(rgb));
		assertEquals(30, ColorTools.blue(rgb));
	}

	@Test
	public void test_labelColors() {
		assertEquals(ColorTools.BLACK, ColorTools.labelToRGB(0));
		for (int label = 1; label <= 500; label++) {
			int rgb = ColorTools.labelToRGB(label);
			// Same color every time
			assertEquals(rgb, ColorTools.labelToRGB(label));
			int sum = ColorTools.red(rgb) + ColorTools.green(rgb) + ColorTools.blue(rgb);
			assertTrue(sum >= 96, "Label " + label + " is too dark");
		}
		assertNotEquals(ColorTools.labelToRGB(1), ColorTools.labelToRGB(2));
	}

}
