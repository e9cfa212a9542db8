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

package temnano.lib.analysis.algorithms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestThresholding {

	@Test
	public void test_thresholdIsExclusive() {
		var img = SimpleImages.createFloatImage(new float[] {0.49f, 0.5f, 0.51f, Float.NaN}, 4, 1);
		var mask = Thresholding.binarize(img, 0.5, false);
		assertTrue(mask.get(0, 0));
		assertFalse(mask.get(1, 0));
		assertFalse(mask.get(2, 0));
		assertFalse(mask.get(3, 0));
	}

	@Test
	public void test_thresholdLimits() {
		var img = SimpleImages.createFloatImage(new float[] {0f, 0.5f, 1f}, 3, 1);
		assertEquals(0, Thresholding.binarize(img, 0, false).countTrue());
		assertEquals(2, Thresholding.binarize(img, 1, false).countTrue());
		assertThrows(IllegalArgumentException.class, () -> Thresholding.binarize(img, -0.01, false));
		assertThrows(IllegalArgumentException.class, () -> Thresholding.binarize(img, 1.01, false));
		assertThrows(IllegalArgumentException.class, () -> Thresholding.binarize(img, Double.NaN, false));
	}

	@Test
	public void test_binarizeIsIdempotent() {
		Random random = new Random(7L);
		var img = SimpleImages.createFloatImage(30, 20);
		for (int y = 0; y < 20; y++) {
			for (int x = 0; x < 30; x++)
				img.setValue(x, y, random.nextFloat());
		}
		for (boolean repair : new boolean[] {false, true}) {
			BinaryMask first = Thresholding.binarize(img, 0.4, repair);
			BinaryMask second = Thresholding.binarize(img, 0.4, repair);
			assertEquals(first, second);
		}
	}

	@Test
	public void test_fillHoles() throws Exception {
		var img = SyntheticImages.createConstant(20, 20, 1f);
		for (int y = 5; y < 15; y++) {
			for (int x = 5; x < 15; x++)
				img.setValue(x, y, 0f);
		}
		for (int y = 9; y <= 10; y++) {
			for (int x = 9; x <= 10; x++)
				img.setValue(x, y, 0.8f);
		}
		var mask = Thresholding.binarize(img, 0.5, false);
		assertEquals(96, mask.countTrue());
		assertFalse(mask.get(9, 9));

		var repaired = Thresholding.binarize(img, 0.5, true);
		assertEquals(100, repaired.countTrue(), repaired.toPrettyString());
		for (int y = 0; y < 20; y++) {
			for (int x = 0; x < 20; x++)
				assertEquals(x >= 5 && x < 15 && y >= 5 && y < 15, repaired.get(x, y));
		}
	}

	@Test
	public void test_fillHolesWithoutBackground() throws Exception {
		var img = SyntheticImages.createConstant(5, 5, 0.1f);
		var mask = Thresholding.thresholdBelow(img, 0.5);
		assertEquals(25, mask.countTrue());
		assertSame(mask, Thresholding.fillHoles(img, mask));
	}

	@Test
	public void test_fillHolesDimensionMismatch() {
		var img = SyntheticImages.createConstant(5, 5, 0.1f);
		assertThrows(temnano.lib.analysis.DimensionMismatchException.class,
				() -> Thresholding.fillHoles(img, BinaryMask.empty(4, 5)));
	}

}
