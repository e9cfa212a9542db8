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

import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.SimpleModifiableImage;
import temnano.lib.analysis.images.SimpleImages;

/**
 * Synthetic micrographs: dark disks on a bright background.
 */
public class SyntheticImages {

	/**
	 * Create an image filled with a constant value.
	 * @param width
	 * @param height
	 * @param value
	 * @return
	 */
	public static SimpleModifiableImage createConstant(int width, int height, float value) {
		var img = SimpleImages.createFloatImage(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				img.setValue(x, y, value);
		}
		return img;
	}

	/**
	 * Set all pixels within a disk to a value.
	 * @param img
	 * @param cx
	 * @param cy
	 * @param radius
	 * @param value
	 */
	public static void fillDisk(SimpleModifiableImage img, int cx, int cy, double radius, float value) {
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				if (inDisk(x, y, cx, cy, radius))
					img.setValue(x, y, value);
			}
		}
	}

	/**
	 * Create a mask that is true inside any of the disks.
	 * @param width
	 * @param height
	 * @param radius
	 * @param centers x and y coordinates of each center
	 * @return
	 */
	public static BinaryMask createDiskMask(int width, int height, double radius, int[]... centers) {
		boolean[] data = new boolean[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				for (int[] c : centers) {
					if (inDisk(x, y, c[0], c[1], radius))
						data[y * width + x] = true;
				}
			}
		}
		return BinaryMask.create(data, width, height);
	}

	static boolean inDisk(int x, int y, int cx, int cy, double radius) {
		double dx = x - cx;
		double dy = y - cy;
		return dx*dx + dy*dy <= radius*radius;
	}

}
