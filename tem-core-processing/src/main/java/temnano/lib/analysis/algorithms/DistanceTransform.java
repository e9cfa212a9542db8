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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.plugin.filter.EDM;
import ij.process.FloatProcessor;
import temnano.imagej.tools.IJTools;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.StatisticsHelper;
import temnano.lib.common.GeneralTools;
import temnano.lib.common.LogTools;

/**
 * Euclidean distance transform of a binary mask, using ImageJ's {@link EDM}.
 * <p>
 * Every foreground pixel gets its distance to the nearest background pixel, while background pixels are 0.
 * Pixels beyond the image boundary do not count as background.
 */
public class DistanceTransform {

	private static final Logger logger = LoggerFactory.getLogger(DistanceTransform.class);

	/**
	 * Quantile of the inverted field used to scale {@link #toDisplayImage(SimpleImage)}.
	 */
	private static final double DISPLAY_QUANTILE = 0.005;

	/**
	 * Compute the distance of every foreground pixel to the nearest background pixel.
	 *
	 * @param mask binary mask, where true indicates foreground
	 * @return a new read-only image with the same dimensions as the mask
	 */
	public static SimpleImage distanceField(BinaryMask mask) {
		Objects.requireNonNull(mask, "Mask must not be null");
		int width = mask.getWidth();
		int height = mask.getHeight();
		if (width * height == 0)
			return SimpleImages.unmodifiable(SimpleImages.createFloatImage(new float[0], width, height));

		if (mask.firstIndexOf(false) < 0) {
			// Nothing to measure to: use an upper bound for any distance within the image
			float fill = width + height;
			LogTools.warnOnce(logger, "Mask has no background pixels - all distances set to " + fill);
			float[] output = new float[width * height];
			Arrays.fill(output, fill);
			return SimpleImages.unmodifiable(SimpleImages.createFloatImage(output, width, height));
		}

		long startTime = System.currentTimeMillis();

		FloatProcessor fpEDM = new EDM().makeFloatEDM(IJTools.convertToByteProcessor(mask), 0, false);
		float[] output = (float[])fpEDM.getPixels();

		long endTime = System.currentTimeMillis();
		logger.trace(String.format("Distance transform time taken: %.2fs", (endTime - startTime)/1000.0));

		return SimpleImages.unmodifiable(SimpleImages.createFloatImage(output, width, height));
	}

	/**
	 * Create an image suitable for displaying a distance field.
	 * <p>
	 * The field is inverted (1 - distance), divided by the absolute value of its 0.5% quantile and shifted by 1,
	 * then clipped to 0-1. The background is therefore white and the deepest pixels inside nanocrystals are black.
	 *
	 * @param distanceField
	 * @return
	 */
	public static SimpleImage toDisplayImage(SimpleImage distanceField) {
		int w = distanceField.getWidth();
		int h = distanceField.getHeight();
		float[] pixels = SimpleImages.getPixels(distanceField, false);
		double[] inverted = new double[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			inverted[i] = 1.0 - pixels[i];
		float[] display = new float[pixels.length];
		if (pixels.length == 0)
			return SimpleImages.unmodifiable(SimpleImages.createFloatImage(display, w, h));
		double scale = Math.abs(StatisticsHelper.getQuantile(inverted, DISPLAY_QUANTILE));
		if (scale == 0 || !Double.isFinite(scale))
			scale = 1.0;
		for (int i = 0; i < display.length; i++)
			display[i] = (float)GeneralTools.clipValue(inverted[i] / scale + 1.0, 0.0, 1.0);
		return SimpleImages.unmodifiable(SimpleImages.createFloatImage(display, w, h));
	}

}
