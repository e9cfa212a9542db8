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

package temnano.imagej.tools;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.common.ColorTools;

/**
 * Collection of static methods to help convert between ImageJ processors and the images used for analysis.
 */
public class IJTools {

	private static final Logger logger = LoggerFactory.getLogger(IJTools.class);

	// Suppressed default constructor for non-instantiability
	private IJTools() {
		throw new AssertionError();
	}

	/**
	 * Convert an ImageJ processor to a grayscale image with values in the range 0-1.
	 * <p>
	 * 8-bit and 16-bit values are divided by the maximum of their type (255 or 65535).
	 * RGB images are converted using the luminance of each pixel.
	 * Float values are used directly if they already lie within 0-1, otherwise they are rescaled
	 * linearly from their minimum and maximum.
	 *
	 * @param ip
	 * @return
	 */
	public static SimpleImage convertToSimpleImage(ImageProcessor ip) {
		Objects.requireNonNull(ip, "ImageProcessor must not be null");
		int w = ip.getWidth();
		int h = ip.getHeight();
		float[] pixels = new float[w * h];
		if (ip instanceof ColorProcessor) {
			int[] rgb = (int[])ip.getPixels();
			for (int i = 0; i < pixels.length; i++) {
				int v = rgb[i];
				pixels[i] = (float)((0.299 * ColorTools.red(v) + 0.587 * ColorTools.green(v) + 0.114 * ColorTools.blue(v)) / 255.0);
			}
		} else if (ip instanceof ByteProcessor) {
			for (int i = 0; i < pixels.length; i++)
				pixels[i] = ip.get(i) / 255f;
		} else if (ip instanceof ShortProcessor) {
			for (int i = 0; i < pixels.length; i++)
				pixels[i] = ip.get(i) / 65535f;
		} else {
			double min = Double.POSITIVE_INFINITY;
			double max = Double.NEGATIVE_INFINITY;
			for (int i = 0; i < pixels.length; i++) {
				float v = ip.getf(i);
				pixels[i] = v;
				if (Float.isFinite(v)) {
					min = Math.min(min, v);
					max = Math.max(max, v);
				}
			}
			if (min < 0 || max > 1) {
				logger.debug("Rescaling float image from range {} - {} to 0-1", min, max);
				double range = max - min;
				for (int i = 0; i < pixels.length; i++)
					pixels[i] = range == 0 ? 0f : (float)((pixels[i] - min) / range);
			}
		}
		return SimpleImages.unmodifiable(SimpleImages.createFloatImage(pixels, w, h));
	}

	/**
	 * Convert an image to a {@link FloatProcessor}.
	 * @param image
	 * @return
	 */
	public static FloatProcessor convertToFloatProcessor(SimpleImage image) {
		return new FloatProcessor(image.getWidth(), image.getHeight(), SimpleImages.getPixels(image, false));
	}

	/**
	 * Convert a mask to a {@link ByteProcessor}, where foreground pixels are 255 and background pixels are 0.
	 * @param mask
	 * @return
	 */
	public static ByteProcessor convertToByteProcessor(BinaryMask mask) {
		int w = mask.getWidth();
		int h = mask.getHeight();
		byte[] pixels = new byte[w * h];
		for (int i = 0; i < pixels.length; i++) {
			if (mask.get(i))
				pixels[i] = (byte)255;
		}
		return new ByteProcessor(w, h, pixels);
	}

	/**
	 * Convert a label image to a {@link ColorProcessor}, using {@link ColorTools#labelToRGB(int)} for each label.
	 * Unlabeled pixels are black.
	 * @param labels
	 * @return
	 */
	public static ColorProcessor convertToColorProcessor(LabelImage labels) {
		int w = labels.getWidth();
		int h = labels.getHeight();
		int[] pixels = new int[w * h];
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = ColorTools.labelToRGB(labels.getLabel(i));
		return new ColorProcessor(w, h, pixels);
	}

	/**
	 * Create an {@link ImagePlus} with a spatial calibration.
	 * @param title
	 * @param ip
	 * @param pixelSize physical size of one pixel, or NaN if unknown
	 * @param unit physical unit
	 * @return
	 */
	public static ImagePlus createImagePlus(String title, ImageProcessor ip, double pixelSize, String unit) {
		ImagePlus imp = new ImagePlus(title, ip);
		if (Double.isFinite(pixelSize) && pixelSize > 0) {
			Calibration cal = imp.getCalibration();
			cal.pixelWidth = pixelSize;
			cal.pixelHeight = pixelSize;
			cal.setUnit(unit);
		}
		return imp;
	}

}
