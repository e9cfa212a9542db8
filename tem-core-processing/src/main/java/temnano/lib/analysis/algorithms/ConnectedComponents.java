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

import java.util.Objects;

import ij.process.FloatProcessor;
import ij.process.FloodFiller;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;

/**
 * Label connected components of a binary mask, using ImageJ's {@link FloodFiller}.
 * <p>
 * Components are numbered 1, 2, 3... in raster order of their first (top left) pixel.
 */
public class ConnectedComponents {

	// Foreground pixels not yet assigned to a component
	private static final float UNLABELED = -1f;

	/**
	 * Label the connected foreground regions of a mask.
	 *
	 * @param mask
	 * @param conn8 true if 8-connectivity should be used; alternative is 4-connectivity
	 * @return a new label image, where background pixels are 0
	 */
	public static LabelImage labelComponents(BinaryMask mask, boolean conn8) {
		Objects.requireNonNull(mask, "Mask must not be null");
		int width = mask.getWidth();
		int height = mask.getHeight();
		int n = width * height;
		if (n == 0)
			return LabelImage.create(new int[0], width, height);

		// Float labels are exact up to 2^24
		FloatProcessor fpLabels = new FloatProcessor(width, height);
		for (int i = 0; i < n; i++) {
			if (mask.get(i))
				fpLabels.setf(i, UNLABELED);
		}

		FloodFiller ff = new FloodFiller(fpLabels);
		int label = 0;
		for (int i = 0; i < n; i++) {
			if (fpLabels.getf(i) != UNLABELED)
				continue;
			label++;
			fpLabels.setValue(label);
			if (conn8)
				ff.fill8(i % width, i / width);
			else
				ff.fill(i % width, i / width);
		}

		int[] labels = new int[n];
		for (int i = 0; i < n; i++)
			labels[i] = (int)fpLabels.getf(i);
		return LabelImage.create(labels, width, height);
	}

}
