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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable 2D binary image.
 * <p>
 * In the pipeline {@code true} marks a nanocrystal (foreground) pixel and {@code false} the background.
 * As a {@link SimpleImage} foreground pixels have the value 1 and background pixels 0.
 */
public final class BinaryMask implements SimpleImage {

	private final BitSet bits;
	private final int width;
	private final int height;

	private BinaryMask(BitSet bits, int width, int height) {
		this.bits = bits;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a mask from a row-major array of booleans. The array is copied.
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static BinaryMask create(boolean[] data, int width, int height) {
		Objects.requireNonNull(data);
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Mask dimensions must be >= 0! Requested " + width + "x" + height);
		if (data.length != width * height)
			throw new IllegalArgumentException(
					String.format("Mask array length %d does not match dimensions %dx%d", data.length, width, height));
		BitSet bits = new BitSet(data.length);
		for (int i = 0; i < data.length; i++) {
			if (data[i])
				bits.set(i);
		}
		return new BinaryMask(bits, width, height);
	}

	/**
	 * Create a mask in which every pixel is {@code false}.
	 * @param width
	 * @param height
	 * @return
	 */
	public static BinaryMask empty(int width, int height) {
		return create(new boolean[width * height], width, height);
	}

	/**
	 * Query whether a pixel is set.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean get(int x, int y) {
		checkBounds(x, y);
		return bits.get(y * width + x);
	}

	/**
	 * Query whether a pixel is set, using its row-major index.
	 * @param ind
	 * @return
	 */
	public boolean get(int ind) {
		if (ind < 0 || ind >= width * height)
			throw new IndexOutOfBoundsException("Index " + ind + " outside mask of " + width * height + " pixels");
		return bits.get(ind);
	}

	/**
	 * Get the number of pixels that are set.
	 * @return
	 */
	public int countTrue() {
		return bits.cardinality();
	}

	/**
	 * Get the index of the first pixel (in raster order) with the requested value.
	 * @param value
	 * @return the row-major index, or -1 if there is no such pixel
	 */
	public int firstIndexOf(boolean value) {
		int ind = value ? bits.nextSetBit(0) : bits.nextClearBit(0);
		return ind >= 0 && ind < width * height ? ind : -1;
	}

	/**
	 * Get a copy of the pixels as a row-major boolean array.
	 * @return
	 */
	public boolean[] toArray() {
		boolean[] data = new boolean[width * height];
		for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i+1))
			data[i] = true;
		return data;
	}

	@Override
	public float getValue(int x, int y) {
		return get(x, y) ? 1f : 0f;
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

	private void checkBounds(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside mask " + width + "x" + height);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bits, width, height);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof BinaryMask))
			return false;
		BinaryMask other = (BinaryMask)obj;
		return width == other.width && height == other.height && bits.equals(other.bits);
	}

	@Override
	public String toString() {
		return String.format("BinaryMask: %dx%d, %d set pixels", width, height, countTrue());
	}

	/**
	 * Convenience method to render the mask with '#' for set pixels and '.' otherwise; useful for debugging small masks.
	 * @return
	 */
	public String toPrettyString() {
		StringBuilder sb = new StringBuilder();
		for (int y = 0; y < height; y++) {
			char[] row = new char[width];
			Arrays.fill(row, '.');
			for (int x = 0; x < width; x++) {
				if (bits.get(y * width + x))
					row[x] = '#';
			}
			sb.append(row).append('\n');
		}
		return sb.toString();
	}

}
