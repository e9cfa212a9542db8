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

package temnano.lib.analysis.pipeline;

import java.util.Objects;

import temnano.lib.analysis.algorithms.MarkerExtraction;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.Histogram;

/**
 * Distribution of distances to the background, in physical units, used to choose the marker quantile.
 * <p>
 * All pixels are included, so the background appears as a peak at 0.
 */
public class DistanceDistribution {

	/**
	 * Default number of histogram bins.
	 */
	public static final int DEFAULT_BINS = 50;

	private final Histogram histogram;
	private final double markerThreshold;

	private DistanceDistribution(Histogram histogram, double markerThreshold) {
		this.histogram = histogram;
		this.markerThreshold = markerThreshold;
	}

	/**
	 * Compute the distance distribution.
	 *
	 * @param distanceField distances in pixels
	 * @param pixelSize physical size of one pixel
	 * @param quantile marker quantile, in the range 0-1
	 * @param nBins number of histogram bins
	 * @return
	 * @throws IllegalArgumentException if the pixel size is not a finite value &gt; 0, the quantile is outside 0-1 or nBins &lt;= 0
	 */
	public static DistanceDistribution compute(SimpleImage distanceField, double pixelSize, double quantile, int nBins) {
		Objects.requireNonNull(distanceField, "Distance field must not be null");
		if (!(Double.isFinite(pixelSize) && pixelSize > 0))
			throw new IllegalArgumentException("Pixel size must be > 0 and finite, but was " + pixelSize);
		float[] pixels = SimpleImages.getPixels(distanceField, false);
		double[] values = new double[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			values[i] = pixels[i] * pixelSize;
		double threshold = MarkerExtraction.computeThreshold(distanceField, quantile) * pixelSize;
		return new DistanceDistribution(new Histogram(values, nBins), threshold);
	}

	/**
	 * Get the histogram of physical distances.
	 * @return
	 */
	public Histogram getHistogram() {
		return histogram;
	}

	/**
	 * Get the distance that marker pixels must exceed, in physical units.
	 * @return
	 */
	public double getMarkerThreshold() {
		return markerThreshold;
	}

	@Override
	public String toString() {
		return "DistanceDistribution [threshold=" + markerThreshold + ", " + histogram + "]";
	}

}
