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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import temnano.lib.analysis.DimensionMismatchException;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;

@SuppressWarnings("javadoc")
public class TestWatershed {

	@Test
	public void test_highestValuesFloodFirst() throws Exception {
		var mask = BinaryMask.create(new boolean[] {false, true, true, true, true, true, true, true, false}, 9, 1);
		var field = DistanceTransform.distanceField(mask);
		var markers = LabelImage.create(new int[] {0, 1, 0, 0, 0, 0, 0, 2, 0}, 9, 1);
		var labels = Watershed.watershed(field, markers, mask);
		// Label 1 reaches the peak first, then continues down the far slope until it meets label 2
		assertArrayEquals(new int[] {0, 1, 1, 1, 1, 1, 0, 2, 0}, labels.toArray());
	}

	@Test
	public void test_twoOverlappingDisks() throws Exception {
		int w = 100, h = 100;
		var mask = SyntheticImages.createDiskMask(w, h, 13, new int[] {37, 50}, new int[] {62, 50});
		var field = DistanceTransform.distanceField(mask);
		int[] markerArray = new int[w * h];
		markerArray[50 * w + 37] = 1;
		markerArray[50 * w + 62] = 2;
		var labels = Watershed.watershed(field, LabelImage.create(markerArray, w, h), mask);

		assertEquals(2, labels.nLabels());
		assertTrue(labels.getPixelCount(1) > 400);
		assertTrue(labels.getPixelCount(2) > 400);
		assertEquals(1, labels.getLabel(37, 50));
		assertEquals(2, labels.getLabel(62, 50));

		for (int y = 0; y < h; y++) {
			int zerosInRow = 0;
			for (int x = 0; x < w; x++) {
				int label = labels.getLabel(x, y);
				if (!mask.get(x, y)) {
					assertEquals(0, label);
					continue;
				}
				if (label == 0) {
					// The boundary is the column equidistant from both centers
					assertEquals(50, x, "Unexpected boundary pixel at " + x + ", " + y);
					zerosInRow++;
				} else if (label == 1) {
					assertTrue(x < 50);
				} else {
					assertTrue(x > 50);
				}
			}
			assertTrue(zerosInRow <= 1, "Boundary wider than one pixel in row " + y);
		}
		assertSeparated(labels);
	}

	@Test
	public void test_conservation() throws Exception {
		var mask = SyntheticImages.createDiskMask(80, 60, 11,
				new int[] {20, 30}, new int[] {38, 30}, new int[] {56, 28}, new int[] {40, 48});
		var field = DistanceTransform.distanceField(mask);
		var markers = MarkerExtraction.extractMarkers(field, 0.97);
		var labels = Watershed.watershed(field, markers, mask);
		// Every marker pixel keeps its label
		for (int i = 0; i < markers.getWidth() * markers.getHeight(); i++) {
			if (markers.getLabel(i) != 0)
				assertEquals(markers.getLabel(i), labels.getLabel(i));
		}
		assertEquals(markers.getLabels(), labels.getLabels());
		assertFalse(labels.getPixelCount(0) == 0);
		assertSeparated(labels);
	}

	@Test
	public void test_unmarkedParticleStaysUnlabeled() throws Exception {
		var mask = SyntheticImages.createDiskMask(60, 30, 6, new int[] {15, 15}, new int[] {45, 15});
		var field = DistanceTransform.distanceField(mask);
		int[] markerArray = new int[60 * 30];
		markerArray[15 * 60 + 15] = 4;
		// A marker on the background is dropped
		markerArray[0] = 9;
		var labels = Watershed.watershed(field, LabelImage.create(markerArray, 60, 30), mask);
		assertEquals(1, labels.nLabels());
		assertEquals(4, labels.getLabel(15, 15));
		assertEquals(0, labels.getLabel(45, 15));
		assertEquals(0, labels.getLabel(0, 0));
		assertEquals(mask.countTrue() / 2, labels.getPixelCount(4));
	}

	@Test
	public void test_dimensionMismatch() {
		var mask = BinaryMask.empty(10, 10);
		var field = DistanceTransform.distanceField(mask);
		assertThrows(DimensionMismatchException.class, () -> Watershed.watershed(field, LabelImage.empty(10, 9), mask));
		assertThrows(DimensionMismatchException.class, () -> Watershed.watershed(field, LabelImage.empty(10, 10), BinaryMask.empty(9, 10)));
	}

	/**
	 * Check that no two different labels are 8-connected.
	 */
	private static void assertSeparated(LabelImage labels) {
		int w = labels.getWidth();
		int h = labels.getHeight();
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int label = labels.getLabel(x, y);
				if (label == 0)
					continue;
				for (int yy = Math.max(0, y-1); yy <= Math.min(h-1, y+1); yy++) {
					for (int xx = Math.max(0, x-1); xx <= Math.min(w-1, x+1); xx++) {
						int other = labels.getLabel(xx, yy);
						assertTrue(other == 0 || other == label, "Labels " + label + " and " + other + " touch at " + x + ", " + y);
					}
				}
			}
		}
	}

}
