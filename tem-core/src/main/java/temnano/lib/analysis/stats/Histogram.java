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

/**
 * Equal-width histogram of a sample, together with the summary statistics of the values it was built from.
 * <p>
 * Each bin includes its lower bound; the last bin also includes the upper bound.
 * Values that are NaN or outside the bounds are not counted.
 */
public class Histogram {

	private final double lowerBound;
	private final double upperBound;
	private final double binWidth;
	private final long[] counts;
	private final long totalCount;
	private final long maxCount;
	private final RunningStatistics statistics;

	/**
	 * Build a histogram between fixed bounds.
	 *
	 * @param values the sample
	 * @param nBins requested number of bins, must be &gt; 0
	 * @param lowerBound lower bound of the first bin, or NaN to use the smallest value
	 * @param upperBound upper bound of the last bin, or NaN to use the largest value
	 * @throws IllegalArgumentException if nBins &lt;= 0
	 */
	public Histogram(double[] values, int nBins, double lowerBound, double upperBound) {
		if (nBins <= 0)
			throw new IllegalArgumentException("Number of bins must be > 0, but was " + nBins);
		statistics = StatisticsHelper.computeRunningStatistics(values);

		double lo = Double.isNaN(lowerBound) ? statistics.getMin() : lowerBound;
		double hi = Double.isNaN(upperBound) ? statistics.getMax() : upperBound;
		double width = (hi - lo) / nBins;
		if (width == 0) {
			// A single unit-width bin centred on the only value
			nBins = 1;
			lo -= 0.5;
			hi += 0.5;
			width = 1;
		} else if (!(width > 0) || Double.isInfinite(width)) {
			nBins = 0;
		}
		this.lowerBound = lo;
		this.upperBound = hi;
		this.binWidth = width;
		this.counts = new long[nBins];

		long total = 0;
		long most = 0;
		if (nBins > 0) {
			for (double v : values) {
				if (!(v >= lo && v <= hi))
					continue;
				int bin = Math.min((int)((v - lo) / width), nBins - 1);
				most = Math.max(most, ++counts[bin]);
				total++;
			}
		}
		this.totalCount = total;
		this.maxCount = most;
	}

	/**
	 * Build a histogram spanning the smallest to the largest value.
	 * @param values
	 * @param nBins
	 */
	public Histogram(double[] values, int nBins) {
		this(values, nBins, Double.NaN, Double.NaN);
	}

	/**
	 * Lower bound of the first bin.
	 * @return
	 */
	public double getLowerBound() {
		return lowerBound;
	}

	/**
	 * Upper bound of the last bin.
	 * @return
	 */
	public double getUpperBound() {
		return upperBound;
	}

	/**
	 * Number of bins; 0 if the sample contained no finite values.
	 * @return
	 */
	public int nBins() {
		return counts.length;
	}

	/**
	 * @param bin
	 * @return the lower bound of the bin
	 */
	public double getBinStart(int bin) {
		checkBin(bin);
		return lowerBound + bin * binWidth;
	}

	/**
	 * @param bin
	 * @return the upper bound of the bin
	 */
	public double getBinEnd(int bin) {
		checkBin(bin);
		return bin == counts.length - 1 ? upperBound : lowerBound + (bin + 1) * binWidth;
	}

	/**
	 * @param bin
	 * @return the difference between the upper and lower bounds of the bin
	 */
	public double getBinWidth(int bin) {
		return getBinEnd(bin) - getBinStart(bin);
	}

	/**
	 * Number of values falling in a bin.
	 * @param bin
	 * @return
	 */
	public long getCount(int bin) {
		checkBin(bin);
		return counts[bin];
	}

	/**
	 * Fraction of all counted values falling in a bin.
	 * @param bin
	 * @return
	 */
	public double getFraction(int bin) {
		return (double)getCount(bin) / totalCount;
	}

	/**
	 * Density estimate for a bin, i.e. its fraction divided by its width.
	 * The bar areas sum to 1, so the result can be plotted on the same axes as a probability density.
	 * @param bin
	 * @return
	 */
	public double getDensity(int bin) {
		return getFraction(bin) / getBinWidth(bin);
	}

	/**
	 * Find the bin that would count a value.
	 * @param value
	 * @return the bin index, or -1 if the value would not be counted
	 */
	public int findBin(double value) {
		if (counts.length == 0 || !(value >= lowerBound && value <= upperBound))
			return -1;
		return Math.min((int)((value - lowerBound) / binWidth), counts.length - 1);
	}

	/**
	 * Largest count of any bin.
	 * @return
	 */
	public long getMaxCount() {
		return maxCount;
	}

	/**
	 * Sum of all bin counts.
	 * @return
	 */
	public long getTotalCount() {
		return totalCount;
	}

	/**
	 * Statistics of every non-NaN value in the sample, including those outside the bounds.
	 * @return
	 */
	public RunningStatistics getStatistics() {
		return statistics;
	}

	private void checkBin(int bin) {
		if (bin < 0 || bin >= counts.length)
			throw new IndexOutOfBoundsException("Bin " + bin + " is outside the range 0-" + (counts.length - 1));
	}

	@Override
	public String toString() {
		return String.format("Histogram [%d bins, %.3g - %.3g, %d values]", nBins(), lowerBound, upperBound, totalCount);
	}

}
