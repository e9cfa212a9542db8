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

import temnano.lib.analysis.DimensionMismatchException;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.common.LogTools;

/**
 * Static methods to separate nanocrystals from the background with a global threshold.
 * <p>
 * Nanocrystals appear dark on a bright substrate: a pixel is foreground if its value is strictly below
 * the threshold, so pixels exactly at the threshold are background.
 */
public class Thresholding {

	private static final Logger logger = LoggerFactory.getLogger(Thresholding.class);

	static final int LABEL_INSIDE = 1;
	static final int LABEL_OUTSIDE = 2;

	private static final int LARGE_IMAGE_PIXELS = 4096 * 4096;

	/**
	 * Create a binary image by thresholding pixels to find where image &lt; threshold.
	 * <p>
	 * NaN pixels are treated as background.
	 * @param image
	 * @param threshold
	 * @return
	 */
	public static BinaryMask thresholdBelow(SimpleImage image, double threshold) {
		int w = image.getWidth();
		int h = image.getHeight();
		float[] pixels = SimpleImages.getPixels(image, true);
		boolean[] mask = new boolean[w * h];
		for (int i = 0; i < mask.length; i++) {
			if (pixels[i] < threshold)
				mask[i] = true;
		}
		return BinaryMask.create(mask, w, h);
	}

	/**
	 * Binarize a grayscale image, optionally repairing holes inside the nanocrystals.
	 *
	 * @param image grayscale image, with values normalized to the range 0-1
	 * @param threshold threshold in the range 0-1
	 * @param repair if true, apply {@link #fillHoles(SimpleImage, BinaryMask)} to the thresholded mask
	 * @return a new mask, where true indicates a nanocrystal pixel
	 * @throws IllegalArgumentException if the threshold is outside the range 0-1
	 */
	public static BinaryMask binarize(SimpleImage image, double threshold, boolean repair) {
		Objects.requireNonNull(image, "Image must not be null");
		if (!(threshold >= 0 && threshold <= 1))
			throw new IllegalArgumentException("Threshold must be between 0 and 1, but was " + threshold);
		BinaryMask mask = thresholdBelow(image, threshold);
		logger.debug("Threshold {}: {} of {} pixels in foreground", threshold, mask.countTrue(), image.getWidth() * image.getHeight());
		if (!repair)
			return mask;
		try {
			return fillHoles(image, mask);
		} catch (DimensionMismatchException e) {
			// Cannot happen, since the mask was created from the image
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Repair a thresholded mask using seeded region growing.
	 * <p>
	 * Every foreground pixel seeds an 'inside' region, and the first background pixel in raster order seeds an
	 * 'outside' region. Both regions then grow across the grayscale image, and every pixel not claimed by the
	 * outside region becomes foreground. Holes that are enclosed by a nanocrystal are filled because the outside
	 * region cannot reach them.
	 * <p>
	 * Note that this is slow for large images, and that growth across faint gaps can merge neighboring
	 * nanocrystals.
	 *
	 * @param image grayscale image used to order the growth
	 * @param mask thresholded mask
	 * @return the repaired mask
	 * @throws DimensionMismatchException if the image and mask differ in size
	 */
	public static BinaryMask fillHoles(SimpleImage image, BinaryMask mask) throws DimensionMismatchException {
		SimpleImages.checkDimensions(image, mask);
		int outsideSeed = mask.firstIndexOf(false);
		if (outsideSeed < 0) {
			logger.debug("No background pixels found - mask will not be changed");
			return mask;
		}
		int w = mask.getWidth();
		int h = mask.getHeight();
		if ((long)w * h > LARGE_IMAGE_PIXELS)
			LogTools.warnOnce(logger, "Region growing on large images can be very slow");
		int[] seeds = new int[w * h];
		for (int i = 0; i < seeds.length; i++) {
			if (mask.get(i))
				seeds[i] = LABEL_INSIDE;
		}
		seeds[outsideSeed] = LABEL_OUTSIDE;

		LabelImage regions = SeededRegionGrowing.growRegions(image, LabelImage.create(seeds, w, h));

		boolean[] repaired = new boolean[w * h];
		for (int i = 0; i < repaired.length; i++)
			repaired[i] = regions.getLabel(i) != LABEL_OUTSIDE;
		BinaryMask result = BinaryMask.create(repaired, w, h);
		logger.debug("Region growing changed foreground from {} to {} pixels", mask.countTrue(), result.countTrue());
		return result;
	}

}
