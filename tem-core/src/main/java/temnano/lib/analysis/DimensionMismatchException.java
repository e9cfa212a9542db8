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

package temnano.lib.analysis;

/**
 * Thrown when a stage is given images that do not share the same width and height.
 */
public class DimensionMismatchException extends SegmentationException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param expectedWidth
	 * @param expectedHeight
	 * @param width
	 * @param height
	 */
	public DimensionMismatchException(int expectedWidth, int expectedHeight, int width, int height) {
		super(String.format("Image dimensions do not match: expected %dx%d but found %dx%d",
				expectedWidth, expectedHeight, width, height));
	}

}
