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

package temnano.lib.regions;

import java.util.Objects;

/**
 * Class for defining an axis-aligned image region.
 * <p>
 * The bounding box is given in pixel coordinates: {@code x} and {@code y} define the top left pixel,
 * and the region covers {@code width} columns and {@code height} rows from there.
 */
public class ImageRegion {

	private final int x;
	private final int y;
	private final int width;
	private final int height;

	@Override
	public String toString() {
		return "Region: x=" + x + ", y=" + y + ", w=" + width + ", h=" + height;
	}

	ImageRegion(final int x, final int y, final int width, final int height) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a region based on its bounding box coordinates.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImageRegion createInstance(final int x, final int y, final int width, final int height) {
		if (width < 0)
			throw new IllegalArgumentException("Width must be >= 0! Requested width = " + width);
		if (height < 0)
			throw new IllegalArgumentException("Height must be >= 0! Requested height = " + height);
		return new ImageRegion(x, y, width, height);
	}

	/**
	 * Create the smallest pixel region containing a rectangle given in (possibly fractional) image coordinates,
	 * e.g. the visible extent of a zoomed viewer.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImageRegion createInstance(final double x, final double y, final double width, final double height) {
		int x1 = (int)Math.floor(x);
		int y1 = (int)Math.floor(y);
		int x2 = (int)Math.ceil(x + width);
		int y2 = (int)Math.ceil(y + height);
		return createInstance(x1, y1, x2-x1, y2-y1);
	}

	/**
	 * Get the part of this region that lies inside an image of the specified size.
	 * @param imageWidth
	 * @param imageHeight
	 * @return the clipped region, which may be empty (zero width or height)
	 */
	public ImageRegion clip(final int imageWidth, final int imageHeight) {
		int x1 = Math.max(0, x);
		int y1 = Math.max(0, y);
		int x2 = Math.min(imageWidth, x + width);
		int y2 = Math.min(imageHeight, y + height);
		return createInstance(x1, y1, Math.max(0, x2 - x1), Math.max(0, y2 - y1));
	}

	/**
	 * Returns true if the region has zero width or height.
	 * @return
	 */
	public boolean isEmpty() {
		return width == 0 || height == 0;
	}

	/**
	 * Returns true if the region contains the specified pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(final int x, final int y) {
		return x >= this.x && x < this.x + width && y >= this.y && y < this.y + height;
	}

	/**
	 * Get the x coordinate of the top left of the region.
	 * @return
	 */
	public int getX() {
		return x;
	}

	/**
	 * Get the y coordinate of the top left of the region.
	 * @return
	 */
	public int getY() {
		return y;
	}

	/**
	 * Get the width of the region.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the height of the region.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the x coordinate of the bottom right of the region (exclusive).
	 * @return
	 */
	public int getMaxX() {
		return x + width;
	}

	/**
	 * Get the y coordinate of the bottom right of the region (exclusive).
	 * @return
	 */
	public int getMaxY() {
		return y + height;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, width, height);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ImageRegion other = (ImageRegion) obj;
		return x == other.x && y == other.y && width == other.width && height == other.height;
	}

}
