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

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.images.LabelImage;

/**
 * Remove segments that may be cut off by the image boundary.
 */
public class BorderFiltering {

	private static final Logger logger = LoggerFactory.getLogger(BorderFiltering.class);

	/**
	 * Set every segment with at least one pixel in the border band to 0.
	 * <p>
	 * Pixel (x, y) is in the band if {@code min(x, y, width-1-x, height-1-y) <= margin}, so a margin of 0 removes
	 * segments touching the outermost pixels. Labels of the remaining segments are unchanged.
	 *
	 * @param labels
	 * @param margin width of the band, in pixels
	 * @return a new label image
	 * @throws IllegalArgumentException if the margin is negative
	 */
	public static LabelImage filterBorder(LabelImage labels, int margin) {
		Objects.requireNonNull(labels, "Labels must not be null");
		if (margin < 0)
			throw new IllegalArgumentException("Border margin must be >= 0, but was " + margin);

		int w = labels.getWidth();
		int h = labels.getHeight();
		Set<Integer> touching = new HashSet<>();
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int label = labels.getLabel(x, y);
				if (label != 0 && isInBorder(x, y, w, h, margin))
					touching.add(label);
			}
		}
		if (touching.isEmpty())
			return labels;

		int[] filtered = labels.toArray();
		for (int i = 0; i < filtered.length; i++) {
			if (touching.contains(filtered[i]))
				filtered[i] = 0;
		}
		logger.debug("Removed {} of {} segments within {} pixels of the border", touching.size(), labels.nLabels(), margin);
		return LabelImage.create(filtered, w, h);
	}

	static boolean isInBorder(int x, int y, int width, int height, int margin) {
		int d = Math.min(Math.min(x, y), Math.min(width - 1 - x, height - 1 - y));
		return d <= margin;
	}

}
