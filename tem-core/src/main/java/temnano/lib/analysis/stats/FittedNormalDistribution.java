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

import java.util.Objects;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * A normal distribution fitted to a sample by maximum likelihood.
 * <p>
 * The standard deviation is the population estimate (divisor n, not n-1), which is the maximum likelihood
 * estimate. A sample of a single value therefore has a standard deviation of 0.
 */
public class FittedNormalDistribution {

	private final double mean;
	private final double stdDev;
	private final int n;

	private FittedNormalDistribution(double mean, double stdDev, int n) {
		this.mean = mean;
		this.stdDev = stdDev;
		this.n = n;
	}

	/**
	 * Fit a normal distribution to the values.
	 * @param values
	 * @return
	 * @throws IllegalArgumentException if there are no values, or any value is not finite
	 */
	public static FittedNormalDistribution fit(double... values) {
		Objects.requireNonNull(values);
		if (values.length == 0)
			throw new IllegalArgumentException("Cannot fit a distribution to an empty sample");
		for (double v : values) {
			if (!Double.isFinite(v))
				throw new IllegalArgumentException("Cannot fit a distribution to non-finite value " + v);
		}
		double mean = new Mean().evaluate(values);
		double stdDev = new StandardDeviation(false).evaluate(values, mean);
		return new FittedNormalDistribution(mean, stdDev, values.length);
	}

	/**
	 * Get the fitted mean.
	 * @return
	 */
	public double getMean() {
		return mean;
	}

	/**
	 * Get the fitted (population) standard deviation.
	 * @return
	 */
	public double getStdDev() {
		return stdDev;
	}

	/**
	 * Get the number of values used for fitting.
	 * @return
	 */
	public int getSampleSize() {
		return n;
	}

	/**
	 * Evaluate the probability density function.
	 * <p>
	 * If the standard deviation is 0 the distribution is degenerate; the density is then infinite at the mean
	 * and 0 elsewhere.
	 * @param x
	 * @return
	 */
	public double density(double x) {
		if (stdDev == 0)
			return x == mean ? Double.POSITIVE_INFINITY : 0.0;
		return new NormalDistribution(null, mean, stdDev).density(x);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mean, stdDev, n);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FittedNormalDistribution))
			return false;
		FittedNormalDistribution other = (FittedNormalDistribution)obj;
		return Double.compare(mean, other.mean) == 0 && Double.compare(stdDev, other.stdDev) == 0 && n == other.n;
	}

	@Override
	public String toString() {
		return String.format("Normal(mean=%.4g, std.dev=%.4g, n=%d)", mean, stdDev, n);
	}

}
