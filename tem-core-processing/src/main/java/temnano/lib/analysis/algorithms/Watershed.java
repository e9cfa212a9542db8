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
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.DimensionMismatchException;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;

/**
 * Implementation of 2D marker-controlled watershed transform.
 * <p>
 * Regions grow from the markers into their neighbors in order of decreasing pixel value, i.e. from the
 * maxima of a distance field (the cores of the nanocrystals) towards the background. Pixels with equal values
 * are processed in the order they were queued, starting from the pixels bordering the markers in raster order,
 * so the result is fully deterministic.
 * <p>
 * A pixel whose labeled neighbors belong to two or more different regions becomes part of a boundary:
 * it keeps the label 0 and is never revisited. Two different labels are therefore never adjacent.
 */
public class Watershed {

	private static final Logger logger = LoggerFactory.getLogger(Watershed.class);

	/**
	 * Segment the nanocrystals by flooding the distance field from the markers, then clip to the foreground mask.
	 *
	 * @param distanceField distance of each pixel to the background
	 * @param markers starting labels
	 * @param mask foreground mask used to compute the distance field
	 * @return a new label image, where background and boundary pixels are 0
	 * @throws DimensionMismatchException if the inputs do not all have the same dimensions
	 */
	public static LabelImage watershed(SimpleImage distanceField, LabelImage markers, BinaryMask mask) throws DimensionMismatchException {
		Objects.requireNonNull(distanceField, "Distance field must not be null");
		Objects.requireNonNull(markers, "Markers must not be null");
		Objects.requireNonNull(mask, "Mask must not be null");
		SimpleImages.checkDimensions(distanceField, markers, mask);
		// Markers may only start on the foreground
		LabelImage seeds = clipToMask(markers, mask);
		LabelImage labels = doWatershed(distanceField, seeds, 0, true);
		LabelImage clipped = clipToMask(labels, mask);
		logger.debug("Watershed: {} markers -> {} labels", markers.nLabels(), clipped.nLabels());
		return clipped;
	}

	/**
	 * Apply a 2D watershed transform, constraining region growing using an intensity threshold.
	 *
	 * @param ip image containing intensity information
	 * @param seeds image containing starting labels; not modified
	 * @param minThreshold minimum threshold; labels will not expand into pixels with values less than or equal to the threshold
	 * @param conn8 true if 8-connectivity should be used; alternative is 4-connectivity
	 * @return a new label image
	 * @throws DimensionMismatchException if the image and seeds differ in size
	 */
	public static LabelImage doWatershed(final SimpleImage ip, final LabelImage seeds, final double minThreshold, final boolean conn8) throws DimensionMismatchException {
		SimpleImages.checkDimensions(ip, seeds);

		long startTime = System.currentTimeMillis();

		int width = ip.getWidth();
		int height = ip.getHeight();
		int[] labels = seeds.toArray();

		// Flooding front, seeded from the pixels touching a marker
		WatershedQueueWrapper queue = new WatershedQueueWrapper(ip, labels, minThreshold, conn8);

		while (!queue.isEmpty()) {
			PixelWithValue pwv = queue.poll();
			int lastLabel = getNeighborLabel(labels, pwv.x, pwv.y, width, height, conn8);
			// Boundary between regions (or, in principle, no labeled neighbor at all)
			if (lastLabel <= 0)
				continue;
			labels[pwv.y * width + pwv.x] = lastLabel;
			queue.addNeighbors(pwv.x, pwv.y);
		}

		long endTime = System.currentTimeMillis();
		logger.trace(String.format("Watershed time taken: %.2fs", (endTime - startTime)/1000.0));

		return LabelImage.create(labels, width, height);
	}

	/**
	 * Set every label outside a mask to 0.
	 *
	 * @param labels
	 * @param mask
	 * @return a new label image
	 * @throws DimensionMismatchException if the labels and mask differ in size
	 */
	public static LabelImage clipToMask(LabelImage labels, BinaryMask mask) throws DimensionMismatchException {
		SimpleImages.checkDimensions(labels, mask);
		int[] clipped = labels.toArray();
		for (int i = 0; i < clipped.length; i++) {
			if (!mask.get(i))
				clipped[i] = 0;
		}
		return LabelImage.create(clipped, labels.getWidth(), labels.getHeight());
	}


	/**
	 * Get the single label shared by all labeled neighbors.
	 * @return the label, 0 if there are no labeled neighbors or -1 if neighbors have different labels
	 */
	private static int getNeighborLabel(final int[] labels, final int x, final int y, final int w, final int h, final boolean conn8) {
		int lastLabel = 0;
		for (int yy = Math.max(y-1, 0); yy <= Math.min(h-1, y+1); yy++) {
			for (int xx = Math.max(x-1, 0); xx <= Math.min(w-1, x+1); xx++) {
				if (xx == x && yy == y)
					continue;
				if (!conn8 && xx != x && yy != y)
					continue;
				int label = labels[yy * w + xx];
				if (label <= 0)
					continue;
				if (lastLabel == 0)
					lastLabel = label;
				else if (lastLabel != label)
					return -1;
			}
		}
		return lastLabel;
	}


	private static final class WatershedQueueWrapper {

		private final PriorityQueue<PixelWithValue> queue = new PriorityQueue<>();
		private final boolean[] queued;
		private long counter = 0;
		private final int width, height;
		private final SimpleImage ip;
		private final boolean conn8;

		WatershedQueueWrapper(SimpleImage ip, int[] labels, double minThreshold, boolean conn8) {
			this.ip = ip;
			this.width = ip.getWidth();
			this.height = ip.getHeight();
			this.conn8 = conn8;
			// Pixels that are queued, labeled, or below the flooding level
			queued = new boolean[width * height];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					float val = ip.getValue(x, y);
					// Never flooded
					if (!(val > minThreshold)) {
						queued[y * width + x] = true;
						continue;
					}
					// Already assigned
					if (labels[y * width + x] != 0)
						queued[y * width + x] = true;
				}
			}
			// Add pixels immediately adjacent to a labeled pixel to the queue, in raster order
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					if (!queued[y * width + x] && getNeighborLabel(labels, x, y, width, height, conn8) != 0)
						add(x, y);
				}
			}
		}

		void addNeighbors(int x, int y) {
			for (int yy = y-1; yy <= y+1; yy++) {
				for (int xx = x-1; xx <= x+1; xx++) {
					if (xx == x && yy == y)
						continue;
					if (!conn8 && xx != x && yy != y)
						continue;
					add(xx, yy);
				}
			}
		}

		private void add(int x, int y) {
			// Each pixel enters the front once
			if (x < 0 || x >= width || y < 0 || y >= height || queued[y * width + x])
				return;
			// The insertion counter makes equal values leave in FIFO order, so plateaus are split evenly
			queue.add(new PixelWithValue(x, y, ip.getValue(x, y), ++counter));
			queued[y * width + x] = true;
		}

		PixelWithValue poll() {
			return queue.poll();
		}

		boolean isEmpty() {
			return queue.isEmpty();
		}

	}


	private static final class PixelWithValue implements Comparable<PixelWithValue> {

		private final int x, y;
		private final float value;
		private final long count;

		PixelWithValue(final int x, final int y, final float value, final long count) {
			this.x = x;
			this.y = y;
			this.value = value;
			this.count = count;
		}

		@Override
		public int compareTo(final PixelWithValue pwv) {
			// Highest value first, then FIFO
			if (value < pwv.value)
				return 1;
			else if (value > pwv.value)
				return -1;
			return Long.compare(count, pwv.count);
		}

	}

}
