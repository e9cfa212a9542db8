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

package temnano.lib.analysis.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import temnano.lib.analysis.algorithms.BorderFiltering;
import temnano.lib.analysis.algorithms.DistanceTransform;
import temnano.lib.analysis.algorithms.MarkerExtraction;
import temnano.lib.analysis.algorithms.ScaleCalibration;
import temnano.lib.analysis.algorithms.SizeEstimation;
import temnano.lib.analysis.algorithms.SyntheticImages;
import temnano.lib.analysis.algorithms.Thresholding;
import temnano.lib.analysis.algorithms.Watershed;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleModifiableImage;
import temnano.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestPipelineRoundTrip {

	/**
	 * 100x100 image with a dark disk of radius 10 at (50, 50), and a white 20-pixel scale bar near the bottom.
	 */
	static SimpleModifiableImage createDiskImage() {
		var img = SyntheticImages.createConstant(100, 100, 0.8f);
		SyntheticImages.fillDisk(img, 50, 50, 10, 0.1f);
		for (int x = 10; x < 30; x++)
			img.setValue(x, 95, 1f);
		return img;
	}

	static final ImageRegion SCALE_BAR_REGION = ImageRegion.createInstance(5, 90, 30, 8);

	@Test
	public void test_singleDisk() throws Exception {
		SimpleImage img = createDiskImage();

		var calibration = ScaleCalibration.calibrate(img, SCALE_BAR_REGION, 100.0);
		double pixelSize = calibration.getPixelSize();
		assertEquals(100.0 / 19.0, pixelSize, 1e-12);

		var mask = Thresholding.binarize(img, 0.5, false);
		int area = mask.countTrue();
		assertTrue(area > 300 && area < 330, "Unexpected disk area " + area);

		var field = DistanceTransform.distanceField(mask);
		float maxDistance = field.getValue(50, 50);
		assertTrue(maxDistance >= 9.5 && maxDistance <= 11.5, "Unexpected max distance " + maxDistance);

		var markers = MarkerExtraction.extractMarkers(field, 0.9);
		assertEquals(1, markers.nLabels());
		assertEquals(1, markers.getLabel(50, 50));

		var labels = Watershed.watershed(field, markers, mask);
		assertEquals(1, labels.nLabels());
		assertEquals(area, labels.getPixelCount(1));

		var filtered = BorderFiltering.filterBorder(labels, 10);
		assertEquals(labels, filtered);

		var sizes = SizeEstimation.estimateSizes(filtered, pixelSize, 0, 1000);
		assertEquals(1, sizes.size());
		assertEquals(Math.sqrt(area) * pixelSize, sizes.getSizes()[0], 1e-9);
		assertEquals(0.0, sizes.getDistribution().getStdDev());
	}

	@Test
	public void test_session() throws Exception {
		var params = PipelineParameters.builder()
				.scaleBarRegion(SCALE_BAR_REGION)
				.sizeRange(0, 1000)
				.build();
		var session = new PipelineSession(createDiskImage(), params);
		var sizes = session.getSizeDistribution();
		assertEquals(1, sizes.size());
		assertEquals(Math.sqrt(session.getMask().countTrue()) * 100.0 / 19.0, sizes.getDistribution().getMean(), 1e-9);
		assertTrue(sizes.getSummary("nm").endsWith("n=1 particles"));
	}

	@Test
	public void test_distanceDistribution() throws Exception {
		var mask = Thresholding.binarize(createDiskImage(), 0.5, false);
		var field = DistanceTransform.distanceField(mask);
		var dist = DistanceDistribution.compute(field, 2.0, 0.9, DistanceDistribution.DEFAULT_BINS);
		assertEquals(50, dist.getHistogram().nBins());
		assertEquals(10_000, dist.getHistogram().getTotalCount());
		assertEquals(0.0, dist.getMarkerThreshold());
		assertEquals(2.0 * field.getValue(50, 50), dist.getHistogram().getUpperBound(), 1e-6);
		// Background dominates
		assertEquals(10_000 - mask.countTrue(), dist.getHistogram().getCount(0));

		var high = DistanceDistribution.compute(field, 2.0, 1.0, 10);
		assertEquals(dist.getHistogram().getUpperBound(), high.getMarkerThreshold(), 1e-6);
	}

}
