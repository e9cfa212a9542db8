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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.StatisticsHelper;

@SuppressWarnings("javadoc")
public class TestMarkerExtraction {

	@Test
	public void test_quantileContract() {
		// Ten distances: 0 x 4, then 1, 2, 3, 4, 5, 6
		var field = SimpleImages.createFloatImage(new float[] {0, 0, 0, 0, 1, 2, 3, 4, 5, 6}, 5, 2);
		// Linear interpolation: h = 9 * 0.8 = 7.2 -> 4 + 0.2
		assertEquals(4.2, MarkerExtraction.computeThreshold(field, 0.8), 1e-6);
		var candidates = MarkerExtraction.findCandidates(field, 0.8);
		// Strictly greater than the threshold
		assertEquals(2, candidates.countTrue());
		assertTrue(candidates.get(3, 1));
		assertTrue(candidates.get(4, 1));

		// Background zeros take part in the quantile
		assertEquals(0.0, MarkerExtraction.computeThreshold(field, 0.3), 1e-12);
		assertEquals(6, MarkerExtraction.findCandidates(field, 0.3).countTrue());
		assertEquals(StatisticsHelper.getQuantile(field, 0.55), MarkerExtraction.computeThreshold(field, 0.55));
	}

	@Test
	public void test_extremeQuantiles() {
		var mask = SyntheticImages.createDiskMask(40, 40, 8, new int[] {20, 20});
		var field = DistanceTransform.distanceField(mask);
		// q = 0: every pixel above the minimum (i.e. the whole foreground)
		assertEquals(mask.countTrue(), MarkerExtraction.findCandidates(field, 0).countTrue());
		// q = 1: nothing exceeds the maximum
		assertEquals(0, MarkerExtraction.findCandidates(field, 1).countTrue());
		assertEquals(0, MarkerExtraction.extractMarkers(field, 1).nLabels());
	}

	@Test
	public void test_monotonicInQuantile() {
		var mask = SyntheticImages.createDiskMask(80, 60, 12, new int[] {20, 30}, new int[] {45, 28}, new int[] {65, 35});
		var field = DistanceTransform.distanceField(mask);
		int lastCount = Integer.MAX_VALUE;
		for (int i = 0; i <= 20; i++) {
			double q = i / 20.0;
			int count = MarkerExtraction.findCandidates(field, q).countTrue();
			assertTrue(count <= lastCount, "Candidates increased at quantile " + q);
			lastCount = count;
		}
	}

	@Test
	public void test_markersPerParticle() {
		// Two well-separated disks: a high quantile leaves one core in each
		var mask = SyntheticImages.createDiskMask(60, 30, 8, new int[] {15, 15}, new int[] {45, 15});
		var field = DistanceTransform.distanceField(mask);
		var markers = MarkerExtraction.extractMarkers(field, 0.95);
		assertEquals(2, markers.nLabels());
		assertEquals(1, markers.getLabel(15, 15));
		assertEquals(2, markers.getLabel(45, 15));
	}

	@Test
	public void test_invalidQuantile() {
		var field = SimpleImages.createFloatImage(new float[] {0, 1}, 2, 1);
		assertThrows(IllegalArgumentException.class, () -> MarkerExtraction.extractMarkers(field, -0.5));
		assertThrows(IllegalArgumentException.class, () -> MarkerExtraction.extractMarkers(field, 1.5));
	}

}
