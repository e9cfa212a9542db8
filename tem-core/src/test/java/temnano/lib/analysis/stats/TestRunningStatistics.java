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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestRunningStatistics {

	private static final RunningStatistics stats = new RunningStatistics();
	private static final List<Double> list = new ArrayList<>();

	@BeforeAll
	public static void test_addValues() {
		Random random = new Random(42L);
		int size = 1000 + random.nextInt(1000);

		// Pixel-like values, with a couple of NaNs mixed in
		for (int i = 0; i < size; i++) {
			list.add(random.nextDouble());
			if (i == size / 3 || i == size / 2)
				list.add(Double.NaN);
		}
		for (double v : list)
			stats.addValue(v);

		assertEquals(list.size() - 2, stats.size());
	}

	@Test
	public void test_numNaNs() {
		assertEquals(2, stats.getNumNaNs());
	}

	@Test
	public void test_metrics() {
		double[] array = list.stream().filter(e -> !e.isNaN()).mapToDouble(e -> e).toArray();

		assertEquals(Arrays.stream(array).sum(), stats.getSum(), 1e-6);
		assertEquals(Arrays.stream(array).average().getAsDouble(), stats.getMean(), 1e-9);
		assertEquals(new Variance(true).evaluate(array), stats.getVariance(), 1e-9);
		assertEquals(new StandardDeviation(true).evaluate(array), stats.getStdDev(), 1e-9);

		Arrays.sort(array);
		assertEquals(array[0], stats.getMin());
		assertEquals(array[array.length-1], stats.getMax());
		assertEquals(array[array.length-1] - array[0], stats.getRange());
	}

	@Test
	public void test_emptyAndSingle() {
		RunningStatistics empty = new RunningStatistics();
		assertTrue(Double.isNaN(empty.getMean()));
		assertTrue(Double.isNaN(empty.getMin()));
		assertTrue(Double.isNaN(empty.getMax()));

		RunningStatistics single = new RunningStatistics();
		single.addValue(0.25);
		assertEquals(0.25, single.getMean());
		// Sample variance is undefined for a single value
		assertTrue(Double.isNaN(single.getVariance()));
	}

	@Test
	public void test_meanDoesNotOverflow() {
		RunningStatistics large = new RunningStatistics();
		large.addValue(Double.MAX_VALUE);
		large.addValue(Double.MAX_VALUE);
		// The sum overflows, the running mean does not
		assertEquals(Double.POSITIVE_INFINITY, large.getSum());
		assertEquals(Double.MAX_VALUE, large.getMean());
		assertEquals(0.0, large.getVariance());
	}

}
