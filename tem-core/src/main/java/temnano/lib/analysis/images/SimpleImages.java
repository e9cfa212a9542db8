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

package temnano.lib.analysis.images;

import java.util.Objects;

import temnano.lib.analysis.DimensionMismatchException;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 */
public class SimpleImages {

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage)
			return ((SimpleModifiableImage)image).getArray(direct);
		if (image instanceof UnmodifiableSimpleImage)
			return getPixels(((UnmodifiableSimpleImage)image).image, false);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 *
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) {
		Objects.requireNonNull(data);
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Image dimensions must be >= 0! Requested " + width + "x" + height);
		if (data.length != width * height)
			throw new IllegalArgumentException(
					String.format("Pixel array length %d does not match image dimensions %dx%d", data.length, width, height));
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a float array of pixels.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height) {
		return createFloatImage(new float[width * height], width, height);
	}

	/**
	 * Create a modifiable copy of an image, which does not share any pixel buffer with the original.
	 * @param image
	 * @return
	 */
	public static SimpleModifiableImage copy(SimpleImage image) {
		float[] pixels = getPixels(image, false);
		if (image instanceof SimpleModifiableImage)
			pixels = pixels.clone();
		return createFloatImage(pixels, image.getWidth(), image.getHeight());
	}

	/**
	 * Get a read-only view of an image.
	 * <p>
	 * This is how pipeline artifacts are handed to callers: the underlying buffer is private to the
	 * stage that created it, so the view is effectively immutable.
	 * @param image
	 * @return
	 */
	public static SimpleImage unmodifiable(SimpleImage image) {
		Objects.requireNonNull(image);
		if (image instanceof UnmodifiableSimpleImage || image instanceof BinaryMask || image instanceof LabelImage)
			return image;
		return new UnmodifiableSimpleImage(image);
	}

	/**
	 * Check whether two images have the same width and height.
	 * @param image1
	 * @param image2
	 * @return
	 */
	public static boolean sameDimensions(SimpleImage image1, SimpleImage image2) {
		return image1.getWidth() == image2.getWidth() && image1.getHeight() == image2.getHeight();
	}

	/**
	 * Ensure that all the images have the same dimensions as the first.
	 * @param images
	 * @throws DimensionMismatchException if any image differs in width or height
	 */
	public static void checkDimensions(SimpleImage... images) throws DimensionMismatchException {
		if (images.length == 0)
			return;
		SimpleImage first = Objects.requireNonNull(images[0]);
		for (int i = 1; i < images.length; i++) {
			SimpleImage other = Objects.requireNonNull(images[i]);
			if (!sameDimensions(first, other))
				throw new DimensionMismatchException(first.getWidth(), first.getHeight(), other.getWidth(), other.getHeight());
		}
	}

	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage {

		private float[] data;
		private int width;
		private int height;

		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[index(x, y)];
		}

		@Override
		public void setValue(int x, int y, float val) {
			data[index(x, y)] = val;
		}

		private int index(int x, int y) {
			if (x < 0 || x >= width || y < 0 || y >= height)
				throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside image " + width + "x" + height);
			return y * width + x;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}

	}


	static class UnmodifiableSimpleImage implements SimpleImage {

		private final SimpleImage image;

		UnmodifiableSimpleImage(SimpleImage image) {
			this.image = image;
		}

		@Override
		public float getValue(int x, int y) {
			return image.getValue(x, y);
		}

		@Override
		public int getWidth() {
			return image.getWidth();
		}

		@Override
		public int getHeight() {
			return image.getHeight();
		}

	}

}
