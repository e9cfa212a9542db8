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

package temnano.lib.analysis.stats;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;

/**
 * Static methods for computing statistics from images and arrays.
 */
public class StatisticsHelper {

	/**
	 * Compute running statistics using all pixels from a SimpleImage.
	 * @param img
	 * @return
	 */
	public static RunningStatistics computeRunningStatistics(SimpleImage img) {
		RunningStatistics stats = new RunningStatistics();
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				stats.addValue(img.getValue(x, y));
			}
		}
		return stats;
	}

	/**
	 * Create a RunningStatistics object using all the values from a specified array.
	 *
	 * @param values
	 * @return
	 */
	public static RunningStatistics computeRunningStatistics(double[] values) {
		RunningStatistics stats = new RunningStatistics();
		for (double v : values) {
			stats.addValue(v);
		}
		return stats;
	}

	/**
	 * Compute a quantile of an array of values, using linear interpolation between the order statistics
	 * (Hyndman &amp; Fan definition 7, the default in R).
	 * <p>
	 * NaNs are removed first; the input array is not modified.
	 *
	 * @param values
	 * @param quantile the quantile, in the range 0-1
	 * @return the quantile value, or NaN if there are no non-NaN values
	 */
	public static double getQuantile(double[] values, double quantile) {
		if (!(quantile >= 0 && quantile <= 1))
			throw new IllegalArgumentException("Quantile must be between 0 and 1, but was " + quantile);
		double[] finite = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
		if (finite.length == 0)
			return Double.NaN;
		// Percentile requires p in (0, 100]; type 7 gives the minimum at 0
		if (quantile == 0)
			return Arrays.stream(finite).min().getAsDouble();
		return new Percentile()
				.withEstimationType(EstimationType.R_7)
				.evaluate(finite, quantile * 100.0);
	}

	/**
	 * Compute a quantile of all the pixel values in an image.
	 * @param img
	 * @param quantile the quantile, in the range 0-1
	 * @return
	 * @see #getQuantile(double[], double)
	 */
	public static double getQuantile(SimpleImage img, double quantile) {
		float[] pixels = SimpleImages.getPixels(img, true);
		double[] values = new double[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			values[i] = pixels[i];
		return getQuantile(values, quantile);
	}

}
