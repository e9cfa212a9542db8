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

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.DimensionMismatchException;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.RunningStatistics;

/**
 * Implementation of 2D seeded region growing, with 8-connectivity.
 * <p>
 * Each non-zero seed label defines one region, which may be made up of many pixels. Unlabeled pixels bordering
 * a region are claimed in order of how close their value is to the region's mean value; the mean is updated as
 * pixels are added. A claimed pixel joins the neighboring region with the closest mean (the lowest label on ties),
 * and pixels with equal priority are processed in the order they were queued.
 * <p>
 * For algorithm details, see:
 *   Adams, R. &amp; Bischof, L. (1994).
 *     Seeded Region Growing. IEEE Transactions on Pattern Analysis and Machine Intelligence
 * <p>
 * The cost is O(n log n) in the number of pixels, with a priority queue holding up to 8 entries per pixel.
 */
public class SeededRegionGrowing {

	private static final Logger logger = LoggerFactory.getLogger(SeededRegionGrowing.class);

	/**
	 * Grow regions from seeds until every pixel connected to a seed is labeled.
	 *
	 * @param image image containing intensity information
	 * @param seeds starting labels; not modified
	 * @return a new label image
	 * @throws DimensionMismatchException if the image and seeds differ in size
	 */
	public static LabelImage growRegions(SimpleImage image, LabelImage seeds) throws DimensionMismatchException {
		SimpleImages.checkDimensions(image, seeds);

		long startTime = System.currentTimeMillis();

		int width = image.getWidth();
		int height = image.getHeight();
		int[] labels = seeds.toArray();
		float[] pixels = SimpleImages.getPixels(image, true);

		// Region statistics, indexed by label
		List<RunningStatistics> regions = new ArrayList<>();
		for (int i = 0; i < labels.length; i++) {
			int label = labels[i];
			if (label == 0)
				continue;
			while (regions.size() <= label)
				regions.add(new RunningStatistics());
			regions.get(label).addValue(pixels[i]);
		}

		GrowingQueue queue = new GrowingQueue(pixels, labels, regions, width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (labels[y * width + x] == 0)
					queue.add(x, y);
			}
		}

		long nClaimed = 0;
		while (!queue.isEmpty()) {
			PixelWithDelta pwd = queue.poll();
			int ind = pwd.y * width + pwd.x;
			if (labels[ind] != 0)
				continue;
			int label = queue.closestNeighborLabel(pwd.x, pwd.y);
			if (label == 0)
				continue;
			labels[ind] = label;
			regions.get(label).addValue(pixels[ind]);
			nClaimed++;
			for (int yy = Math.max(pwd.y-1, 0); yy <= Math.min(height-1, pwd.y+1); yy++) {
				for (int xx = Math.max(pwd.x-1, 0); xx <= Math.min(width-1, pwd.x+1); xx++) {
					if (labels[yy * width + xx] == 0)
						queue.add(xx, yy);
				}
			}
		}

		long endTime = System.currentTimeMillis();
		logger.debug(String.format("Seeded region growing claimed %d pixels, time taken: %.2fs", nClaimed, (endTime - startTime)/1000.0));

		return LabelImage.create(labels, width, height);
	}


	private static final class GrowingQueue {

		private final PriorityQueue<PixelWithDelta> queue = new PriorityQueue<>();
		private final float[] pixels;
		private final int[] labels;
		private final List<RunningStatistics> regions;
		private final int width, height;
		private long counter = 0;

		GrowingQueue(float[] pixels, int[] labels, List<RunningStatistics> regions, int width, int height) {
			this.pixels = pixels;
			this.labels = labels;
			this.regions = regions;
			this.width = width;
			this.height = height;
		}

		/**
		 * Queue an unlabeled pixel if it borders at least one region.
		 */
		void add(int x, int y) {
			double delta = closestNeighborDelta(x, y);
			if (Double.isNaN(delta))
				return;
			queue.add(new PixelWithDelta(x, y, delta, ++counter));
		}

		private double closestNeighborDelta(int x, int y) {
			int label = closestNeighborLabel(x, y);
			if (label == 0)
				return Double.NaN;
			return delta(y * width + x, label);
		}

		/**
		 * Get the label of the neighboring region whose mean is closest to the pixel value, or 0 if there is none.
		 */
		int closestNeighborLabel(int x, int y) {
			int ind = y * width + x;
			int bestLabel = 0;
			double bestDelta = Double.POSITIVE_INFINITY;
			for (int yy = Math.max(y-1, 0); yy <= Math.min(height-1, y+1); yy++) {
				for (int xx = Math.max(x-1, 0); xx <= Math.min(width-1, x+1); xx++) {
					int label = labels[yy * width + xx];
					if (label == 0 || label == bestLabel)
						continue;
					double delta = delta(ind, label);
					if (bestLabel == 0 || delta < bestDelta || (delta == bestDelta && label < bestLabel)) {
						bestLabel = label;
						bestDelta = delta;
					}
				}
			}
			return bestLabel;
		}

		private double delta(int ind, int label) {
			double delta = Math.abs(pixels[ind] - regions.get(label).getMean());
			return Double.isNaN(delta) ? Double.POSITIVE_INFINITY : delta;
		}

		PixelWithDelta poll() {
			return queue.poll();
		}

		boolean isEmpty() {
			return queue.isEmpty();
		}

	}


	private static final class PixelWithDelta implements Comparable<PixelWithDelta> {

		private final int x, y;
		private final double delta;
		private final long count;

		PixelWithDelta(final int x, final int y, final double delta, final long count) {
			this.x = x;
			this.y = y;
			this.delta = delta;
			this.count = count;
		}

		@Override
		public int compareTo(final PixelWithDelta pwd) {
			// Smallest difference first, then FIFO
			int cmp = Double.compare(delta, pwd.delta);
			if (cmp != 0)
				return cmp;
			return Long.compare(count, pwd.count);
		}

	}

}
