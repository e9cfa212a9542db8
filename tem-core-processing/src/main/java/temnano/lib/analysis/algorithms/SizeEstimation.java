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

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.EmptySampleException;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.stats.SizeDistribution;

/**
 * Measure the size of each segment and fit a normal distribution to the sizes.
 * <p>
 * The size of a segment is the side of a square with the same area, i.e. {@code sqrt(pixelCount) * pixelSize}.
 */
public class SizeEstimation {

	private static final Logger logger = LoggerFactory.getLogger(SizeEstimation.class);

	/**
	 * Compute the size of one segment.
	 * @param pixelCount
	 * @param pixelSize physical size of one pixel
	 * @return
	 */
	public static double computeSize(long pixelCount, double pixelSize) {
		return Math.sqrt(pixelCount) * pixelSize;
	}

	/**
	 * Measure all labeled segments, keeping only sizes strictly between the minimum and maximum.
	 *
	 * @param labels filtered label image
	 * @param pixelSize physical size of one pixel, must be &gt; 0 and finite
	 * @param minSize sizes &lt;= minSize are discarded
	 * @param maxSize sizes &gt;= maxSize are discarded
	 * @return
	 * @throws EmptySampleException if no segment has an acceptable size
	 * @throws IllegalArgumentException if the pixel size is invalid, or the minimum is greater than the maximum
	 */
	public static SizeDistribution estimateSizes(LabelImage labels, double pixelSize, double minSize, double maxSize) throws EmptySampleException {
		Objects.requireNonNull(labels, "Labels must not be null");
		if (!(pixelSize > 0) || !Double.isFinite(pixelSize))
			throw new IllegalArgumentException("Pixel size must be > 0 and finite, but was " + pixelSize);
		if (Double.isNaN(minSize) || Double.isNaN(maxSize) || minSize > maxSize)
			throw new IllegalArgumentException("Invalid size range " + minSize + " - " + maxSize);

		Map<Integer, Long> counts = labels.getPixelCounts();
		int[] keptLabels = new int[counts.size()];
		double[] keptSizes = new double[counts.size()];
		int n = 0;
		for (Map.Entry<Integer, Long> entry : counts.entrySet()) {
			double size = computeSize(entry.getValue(), pixelSize);
			if (size > minSize && size < maxSize) {
				keptLabels[n] = entry.getKey();
				keptSizes[n] = size;
				n++;
			}
		}
		logger.debug("{} of {} segments with size in range ({}, {})", n, counts.size(), minSize, maxSize);
		if (n == 0)
			throw new EmptySampleException(
					String.format("None of %d segments has a size between %s and %s", counts.size(), minSize, maxSize));
		int[] outLabels = new int[n];
		double[] outSizes = new double[n];
		System.arraycopy(keptLabels, 0, outLabels, 0, n);
		System.arraycopy(keptSizes, 0, outSizes, 0, n);
		return new SizeDistribution(outLabels, outSizes);
	}

}
