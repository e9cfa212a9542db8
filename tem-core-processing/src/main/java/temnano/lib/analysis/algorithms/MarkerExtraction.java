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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.StatisticsHelper;

/**
 * Find the core pixels of each nanocrystal, to be used as seeds for a watershed transform.
 * <p>
 * A pixel is a marker candidate if its distance to the background is strictly greater than the requested quantile
 * of all distances in the image (background pixels included). For example, with a quantile of 0.9 a pixel must be
 * farther from the background than 90% of all pixels. Raising the quantile can only remove candidates.
 * <p>
 * Touching candidates are merged into a single marker using 8-connectivity, so each marker is expected to lie
 * inside exactly one nanocrystal.
 */
public class MarkerExtraction {

	private static final Logger logger = LoggerFactory.getLogger(MarkerExtraction.class);

	/**
	 * Get the distance a pixel must exceed to be a marker candidate.
	 *
	 * @param distanceField
	 * @param quantile quantile of all distance values, in the range 0-1
	 * @return
	 * @throws IllegalArgumentException if the quantile is outside the range 0-1
	 */
	public static double computeThreshold(SimpleImage distanceField, double quantile) {
		Objects.requireNonNull(distanceField, "Distance field must not be null");
		if (!(quantile >= 0 && quantile <= 1))
			throw new IllegalArgumentException("Quantile must be between 0 and 1, but was " + quantile);
		return StatisticsHelper.getQuantile(distanceField, quantile);
	}

	/**
	 * Create a mask of marker candidate pixels, before they are grouped into markers.
	 *
	 * @param distanceField
	 * @param quantile quantile of all distance values, in the range 0-1
	 * @return
	 */
	public static BinaryMask findCandidates(SimpleImage distanceField, double quantile) {
		double threshold = computeThreshold(distanceField, quantile);
		int w = distanceField.getWidth();
		int h = distanceField.getHeight();
		float[] pixels = SimpleImages.getPixels(distanceField, true);
		boolean[] candidates = new boolean[w * h];
		// No candidates if the threshold is NaN (i.e. empty image)
		for (int i = 0; i < candidates.length; i++)
			candidates[i] = pixels[i] > threshold;
		return BinaryMask.create(candidates, w, h);
	}

	/**
	 * Extract labeled markers from a distance field.
	 *
	 * @param distanceField distance of each pixel to the background
	 * @param quantile quantile of all distance values, in the range 0-1
	 * @return a new label image, with one label per connected group of candidate pixels and 0 elsewhere
	 */
	public static LabelImage extractMarkers(SimpleImage distanceField, double quantile) {
		BinaryMask candidates = findCandidates(distanceField, quantile);
		LabelImage markers = ConnectedComponents.labelComponents(candidates, true);
		logger.debug("Quantile {}: {} candidate pixels in {} markers", quantile, candidates.countTrue(), markers.nLabels());
		return markers;
	}

}
