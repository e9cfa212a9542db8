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
 * Thrown when the detected scale bar spans zero pixels horizontally, so that no pixel size can be derived.
 */
public class DegenerateScaleException extends SegmentationException {

	private static final long serialVersionUID = 1L;

	private final int column;

	/**
	 * Constructor.
	 * @param column the single column occupied by the detected bar
	 */
	public DegenerateScaleException(int column) {
		super("Scale bar has zero horizontal extent (all bar pixels are in column " + column + ")");
		this.column = column;
	}

	/**
	 * Get the column containing every detected bar pixel.
	 * @return
	 */
	public int getColumn() {
		return column;
	}

}
