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
 * A {@link SimpleImage} whose pixel values may be changed.
 * <p>
 * Pipeline stages use modifiable images only as private working buffers; anything returned to a caller
 * is wrapped with {@link SimpleImages#unmodifiable(SimpleImage)}.
 */
public interface SimpleModifiableImage extends SimpleImage {

	/**
	 * Set the value of a single pixel.
	 * @param x x-coordinate of the pixel to set
	 * @param y y-coordinate of the pixel to set
	 * @param val new pixel value
	 */
	public void setValue(int x, int y, float val);

	/**
	 * Request the pixel array representing all the pixels in this image, returned row-wise.
	 * @param direct if true, the internal array will be returned if possible
	 * @return
	 */
	float[] getArray(boolean direct);

}
