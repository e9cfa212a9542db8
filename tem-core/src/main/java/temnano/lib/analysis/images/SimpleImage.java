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

/**
 * A minimal interface to define a means to provide access to pixel values from a 2D, 1-channel image.
 * <p>
 * Coordinates follow the usual image convention: {@code x} is the column and {@code y} is the row,
 * with (0,0) at the top left.
 */
public interface SimpleImage {

	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate (column) of the pixel
	 * @param y y-coordinate (row) of the pixel
	 * @return
	 */
	public float getValue(int x, int y);

	/**
	 * Get the image width.
	 * @return
	 */
	public int getWidth();

	/**
	 * Get the image height.
	 * @return
	 */
	public int getHeight();

}
