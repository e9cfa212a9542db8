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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.DegenerateScaleException;
import temnano.lib.analysis.EmptySelectionException;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.regions.ImageRegion;

/**
 * Determine the pixel size of an image from a selected scale bar.
 * <p>
 * The brightest pixels within the selection are taken to be the bar. The pixel size is the physical
 * length of the bar divided by the number of columns between its left-most and right-most pixels,
 * so the selection should not contain any other pixel as bright as the bar.
 */
public class ScaleCalibration {

	private static final Logger logger = LoggerFactory.getLogger(ScaleCalibration.class);

	/**
	 * Compute the pixel size from a scale bar.
	 *
	 * @param image the full image
	 * @param selection the region containing the scale bar; parts outside the image are ignored
	 * @param physicalLength the length of the bar, in physical units (e.g. nm)
	 * @return the pixel size and the detected bar
	 * @throws EmptySelectionException if the selection does not overlap the image, or contains no valid pixel
	 * @throws DegenerateScaleException if all bar pixels lie in a single column
	 * @throws IllegalArgumentException if the physical length is not a finite value &gt; 0
	 */
	public static Result calibrate(SimpleImage image, ImageRegion selection, double physicalLength)
			throws EmptySelectionException, DegenerateScaleException {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(selection, "Selection must not be null");
		if (!(Double.isFinite(physicalLength) && physicalLength > 0))
			throw new IllegalArgumentException("Scale bar length must be a finite value > 0, but was " + physicalLength);

		ImageRegion region = selection.clip(image.getWidth(), image.getHeight());
		if (region.isEmpty())
			throw new EmptySelectionException("Selection " + selection + " does not overlap the image");

		float maxi = Float.NEGATIVE_INFINITY;
		for (int y = region.getY(); y < region.getMaxY(); y++) {
			for (int x = region.getX(); x < region.getMaxX(); x++) {
				float val = image.getValue(x, y);
				if (val > maxi)
					maxi = val;
			}
		}

		int w = region.getWidth();
		int h = region.getHeight();
		boolean[] bar = new boolean[w * h];
		int minCol = Integer.MAX_VALUE;
		int maxCol = -1;
		int nPixels = 0;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (image.getValue(region.getX() + x, region.getY() + y) == maxi) {
					bar[y * w + x] = true;
					nPixels++;
					if (x < minCol)
						minCol = x;
					if (x > maxCol)
						maxCol = x;
				}
			}
		}
		if (nPixels == 0)
			throw new EmptySelectionException("No scale bar pixel found in " + region);
		if (maxCol == minCol)
			throw new DegenerateScaleException(region.getX() + minCol);

		int span = maxCol - minCol;
		double pixelSize = physicalLength / span;
		if (!Double.isFinite(pixelSize) || pixelSize <= 0)
			throw new IllegalArgumentException("Pixel size computed from bar length " + physicalLength + " is invalid: " + pixelSize);

		logger.debug("Scale bar of {} pixels spanning {} columns in {}: pixel size {}", nPixels, span, region, pixelSize);
		return new Result(pixelSize, span, region, BinaryMask.create(bar, w, h));
	}


	/**
	 * The result of a scale calibration.
	 */
	public static class Result {

		private final double pixelSize;
		private final int pixelSpan;
		private final ImageRegion region;
		private final BinaryMask barMask;

		private Result(double pixelSize, int pixelSpan, ImageRegion region, BinaryMask barMask) {
			this.pixelSize = pixelSize;
			this.pixelSpan = pixelSpan;
			this.region = region;
			this.barMask = barMask;
		}

		/**
		 * Get the physical size of a pixel (physical units per pixel).
		 * @return
		 */
		public double getPixelSize() {
			return pixelSize;
		}

		/**
		 * Get the number of columns between the left-most and right-most bar pixels.
		 * @return
		 */
		public int getPixelSpan() {
			return pixelSpan;
		}

		/**
		 * Get the selection, clipped to the image bounds.
		 * @return
		 */
		public ImageRegion getRegion() {
			return region;
		}

		/**
		 * Get a mask of the detected bar, with the same size as {@link #getRegion()}.
		 * @return
		 */
		public BinaryMask getBarMask() {
			return barMask;
		}

		@Override
		public String toString() {
			return String.format("Scale calibration: pixel size %.4g (span %d px)", pixelSize, pixelSpan);
		}

	}

}
