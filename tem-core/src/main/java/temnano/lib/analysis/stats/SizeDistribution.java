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
import java.util.Objects;

import temnano.lib.common.GeneralTools;

/**
 * Sizes of the segmented nanocrystals, together with the normal distribution fitted to them.
 * <p>
 * Sizes are stored in increasing order of the label they were measured from.
 */
public class SizeDistribution {

	private final int[] labels;
	private final double[] sizes;
	private final FittedNormalDistribution distribution;

	/**
	 * Constructor.
	 * @param labels label of each measured segment
	 * @param sizes size of each segment, in physical units
	 * @throws IllegalArgumentException if the arrays differ in length, are empty or contain non-finite sizes
	 */
	public SizeDistribution(int[] labels, double[] sizes) {
		Objects.requireNonNull(labels);
		Objects.requireNonNull(sizes);
		if (labels.length != sizes.length)
			throw new IllegalArgumentException(
					String.format("Number of labels (%d) and sizes (%d) differ", labels.length, sizes.length));
		this.labels = labels.clone();
		this.sizes = sizes.clone();
		this.distribution = FittedNormalDistribution.fit(this.sizes);
	}

	/**
	 * Get the labels of the measured segments.
	 * @return a copy of the labels, in increasing order
	 */
	public int[] getLabels() {
		return labels.clone();
	}

	/**
	 * Get the measured sizes, in the same order as {@link #getLabels()}.
	 * @return a copy of the sizes
	 */
	public double[] getSizes() {
		return sizes.clone();
	}

	/**
	 * Number of measured segments.
	 * @return
	 */
	public int size() {
		return sizes.length;
	}

	/**
	 * Get the normal distribution fitted to the sizes.
	 * @return
	 */
	public FittedNormalDistribution getDistribution() {
		return distribution;
	}

	/**
	 * Create a histogram of the sizes, spanning the smallest to the largest size.
	 * Use {@link Histogram#getDensity(int)} to compare it with {@link FittedNormalDistribution#density(double)}.
	 * @param nBins
	 * @return
	 */
	public Histogram getHistogram(int nBins) {
		return new Histogram(sizes, nBins);
	}

	/**
	 * Get a one-line summary of the fitted distribution, e.g. {@code µ=10.2 nm, σ=1.48 nm, n=57 particles}.
	 * @param unit
	 * @return
	 */
	public String getSummary(String unit) {
		String u = GeneralTools.blankString(unit, true) ? "" : " " + unit.trim();
		return String.format("µ=%s%s, σ=%s%s, n=%d particles",
				GeneralTools.formatSignificant(distribution.getMean(), 3), u,
				GeneralTools.formatSignificant(distribution.getStdDev(), 3), u,
				sizes.length);
	}

	@Override
	public String toString() {
		return "SizeDistribution [labels=" + Arrays.toString(labels) + ", sizes=" + Arrays.toString(sizes) + ", " + distribution + "]";
	}

}
