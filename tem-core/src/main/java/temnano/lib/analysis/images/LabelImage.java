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
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import temnano.lib.regions.ImageRegion;

/**
 * Immutable 2D labeled image.
 * <p>
 * A value of 0 means unlabeled (background or a watershed boundary); any positive integer identifies a segment.
 * Labels are not required to be contiguous: once a segment is removed its label is simply no longer present.
 */
public final class LabelImage implements SimpleImage {

	private final int[] labels;
	private final int width;
	private final int height;

	private SortedSet<Integer> labelSet;
	private Map<Integer, Long> counts;

	private LabelImage(int[] labels, int width, int height) {
		this.labels = labels;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a label image from a row-major array of labels. The array is copied.
	 * @param labels
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the dimensions do not match, or any label is negative
	 */
	public static LabelImage create(int[] labels, int width, int height) {
		Objects.requireNonNull(labels);
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Label image dimensions must be >= 0! Requested " + width + "x" + height);
		if (labels.length != width * height)
			throw new IllegalArgumentException(
					String.format("Label array length %d does not match dimensions %dx%d", labels.length, width, height));
		for (int label : labels) {
			if (label < 0)
				throw new IllegalArgumentException("Labels must be >= 0, but found " + label);
		}
		return new LabelImage(labels.clone(), width, height);
	}

	/**
	 * Create a label image where every pixel is 0.
	 * @param width
	 * @param height
	 * @return
	 */
	public static LabelImage empty(int width, int height) {
		return new LabelImage(new int[width * height], width, height);
	}

	/**
	 * Get the label at a pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getLabel(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside label image " + width + "x" + height);
		return labels[y * width + x];
	}

	/**
	 * Get the label at a row-major index.
	 * @param ind
	 * @return
	 */
	public int getLabel(int ind) {
		return labels[ind];
	}

	/**
	 * Get a copy of the labels as a row-major array.
	 * @return
	 */
	public int[] toArray() {
		return labels.clone();
	}

	/**
	 * Get all distinct labels &gt; 0, in ascending order.
	 * @return
	 */
	public SortedSet<Integer> getLabels() {
		if (labelSet == null) {
			labelSet = Collections.unmodifiableSortedSet(new TreeSet<>(getPixelCounts().keySet()));
		}
		return labelSet;
	}

	/**
	 * Get the number of distinct labels &gt; 0.
	 * @return
	 */
	public int nLabels() {
		return getLabels().size();
	}

	/**
	 * Get the largest label, or 0 if the image contains no labels.
	 * @return
	 */
	public int getMaxLabel() {
		var set = getLabels();
		return set.isEmpty() ? 0 : set.last();
	}

	/**
	 * Get the number of pixels for each label &gt; 0.
	 * @return an unmodifiable map, iterating in ascending label order
	 */
	public Map<Integer, Long> getPixelCounts() {
		if (counts == null) {
			Map<Integer, Long> map = new TreeMap<>();
			for (int label : labels) {
				if (label != 0)
					map.merge(label, 1L, Long::sum);
			}
			counts = Collections.unmodifiableMap(map);
		}
		return counts;
	}

	/**
	 * Get the number of pixels with a specified label.
	 * @param label
	 * @return
	 */
	public long getPixelCount(int label) {
		if (label == 0) {
			return Arrays.stream(labels).filter(l -> l == 0).count();
		}
		return getPixelCounts().getOrDefault(label, 0L);
	}

	/**
	 * Get the bounding box of each label &gt; 0.
	 * @return an unmodifiable map, iterating in ascending label order
	 */
	public Map<Integer, ImageRegion> getBounds() {
		Map<Integer, int[]> extents = new TreeMap<>();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int label = labels[y * width + x];
				if (label == 0)
					continue;
				int[] e = extents.computeIfAbsent(label, l -> new int[] {Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1});
				e[0] = Math.min(e[0], x);
				e[1] = Math.min(e[1], y);
				e[2] = Math.max(e[2], x);
				e[3] = Math.max(e[3], y);
			}
		}
		Map<Integer, ImageRegion> map = new TreeMap<>();
		for (var entry : extents.entrySet()) {
			int[] e = entry.getValue();
			map.put(entry.getKey(), ImageRegion.createInstance(e[0], e[1], e[2] - e[0] + 1, e[3] - e[1] + 1));
		}
		return Collections.unmodifiableMap(map);
	}

	/**
	 * Create a binary mask of all labeled (non-zero) pixels.
	 * @return
	 */
	public BinaryMask toMask() {
		boolean[] data = new boolean[labels.length];
		for (int i = 0; i < labels.length; i++)
			data[i] = labels[i] != 0;
		return BinaryMask.create(data, width, height);
	}

	@Override
	public float getValue(int x, int y) {
		return getLabel(x, y);
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
	public int hashCode() {
		return Objects.hash(width, height, Arrays.hashCode(labels));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof LabelImage))
			return false;
		LabelImage other = (LabelImage)obj;
		return width == other.width && height == other.height && Arrays.equals(labels, other.labels);
	}

	@Override
	public String toString() {
		return String.format("LabelImage: %dx%d, %d labels", width, height, nLabels());
	}

}
