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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the count, extremes, mean and variance of a stream of values without storing them.
 * <p>
 * The region growing stage keeps one instance per region and updates it with every accepted pixel,
 * so the mean must be available after each addition.
 * The variance uses Welford's update, which is stable for long streams of similar values.
 * NaN values are counted separately and otherwise ignored.
 */
public class RunningStatistics {

	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);

	// Beyond this, consecutive doubles differ by more than 1
	private static final double MAX_EXACT_DOUBLE = 0x1p53;

	private long n;
	private long nanCount;
	private double total;
	private double lowest = Double.POSITIVE_INFINITY;
	private double highest = Double.NEGATIVE_INFINITY;
	private double runningMean;
	private double sumSquaredDeviations;

	/**
	 * Add one value.
	 * @param value
	 */
	public void addValue(double value) {
		if (Double.isNaN(value)) {
			nanCount++;
			return;
		}
		n++;
		total += value;
		lowest = Math.min(lowest, value);
		highest = Math.max(highest, value);
		double delta = value - runningMean;
		runningMean += delta / n;
		sumSquaredDeviations += delta * (value - runningMean);
	}

	/**
	 * Number of non-NaN values added.
	 * @return
	 */
	public long size() {
		return n;
	}

	/**
	 * Number of NaN values added.
	 * @return
	 */
	public long getNumNaNs() {
		return nanCount;
	}

	/**
	 * Sum of the non-NaN values.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(total) > MAX_EXACT_DOUBLE)
			logger.warn("Running sum {} exceeds the range of exact doubles, results may be imprecise", total);
		return total;
	}

	/**
	 * Mean of the non-NaN values, or NaN if there are none.
	 * @return
	 */
	public double getMean() {
		return n == 0 ? Double.NaN : runningMean;
	}

	/**
	 * Sample variance, with divisor n-1.
	 * @return the variance, or NaN if fewer than 2 values were added
	 */
	public double getVariance() {
		if (n < 2)
			return Double.NaN;
		if (sumSquaredDeviations > MAX_EXACT_DOUBLE)
			logger.warn("Sum of squared deviations {} exceeds the range of exact doubles, results may be imprecise", sumSquaredDeviations);
		return sumSquaredDeviations / (n - 1);
	}

	/**
	 * Sample standard deviation, i.e. the square root of {@link #getVariance()}.
	 * @return
	 */
	public double getStdDev() {
		return Math.sqrt(getVariance());
	}

	/**
	 * @return the smallest non-NaN value, or NaN if there are none
	 */
	public double getMin() {
		return n == 0 ? Double.NaN : lowest;
	}

	/**
	 * @return the largest non-NaN value, or NaN if there are none
	 */
	public double getMax() {
		return n == 0 ? Double.NaN : highest;
	}

	/**
	 * Difference between the largest and smallest values.
	 * @return
	 */
	public double getRange() {
		return getMax() - getMin();
	}

	@Override
	public String toString() {
		return String.format("RunningStatistics [n=%d, mean=%.4g, sd=%.4g, min=%.4g, max=%.4g]",
				n, getMean(), getStdDev(), getMin(), getMax());
	}

}
