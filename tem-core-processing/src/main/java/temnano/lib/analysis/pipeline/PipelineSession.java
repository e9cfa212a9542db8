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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temnano.lib.analysis.DimensionMismatchException;
import temnano.lib.analysis.EmptySelectionException;
import temnano.lib.analysis.SegmentationException;
import temnano.lib.analysis.algorithms.BorderFiltering;
import temnano.lib.analysis.algorithms.DistanceTransform;
import temnano.lib.analysis.algorithms.MarkerExtraction;
import temnano.lib.analysis.algorithms.ScaleCalibration;
import temnano.lib.analysis.algorithms.SizeEstimation;
import temnano.lib.analysis.algorithms.Thresholding;
import temnano.lib.analysis.algorithms.Watershed;
import temnano.lib.analysis.images.BinaryMask;
import temnano.lib.analysis.images.LabelImage;
import temnano.lib.analysis.images.SimpleImage;
import temnano.lib.analysis.images.SimpleImages;
import temnano.lib.analysis.stats.SizeDistribution;
import temnano.lib.regions.ImageRegion;

/**
 * Holds the latest result of each pipeline stage for a single image.
 * <p>
 * Results are computed lazily when first requested, then cached. Changing a parameter discards the results
 * of the stage that uses it and of every stage downstream, so that only these are recomputed.
 * The scale calibration is independent of the segmentation stages; only the size distribution depends on both.
 * <p>
 * Instances are not thread-safe.
 */
public class PipelineSession {

	private static final Logger logger = LoggerFactory.getLogger(PipelineSession.class);

	/**
	 * Segmentation stages, in processing order.
	 */
	public enum Stage {
		/**
		 * Thresholding, with optional repair.
		 */
		MASK,
		/**
		 * Distance transform.
		 */
		DISTANCE,
		/**
		 * Marker extraction.
		 */
		MARKERS,
		/**
		 * Watershed segmentation.
		 */
		WATERSHED,
		/**
		 * Removal of border segments.
		 */
		BORDER,
		/**
		 * Size estimation.
		 */
		SIZES
	}

	private final SimpleImage image;
	private PipelineParameters params;

	private ScaleCalibration.Result calibration;
	private BinaryMask mask;
	private SimpleImage distanceField;
	private LabelImage markers;
	private LabelImage labels;
	private LabelImage filteredLabels;
	private SizeDistribution sizeDistribution;

	/**
	 * Create a session using the default parameters.
	 * @param image grayscale image, with values normalized to the range 0-1
	 */
	public PipelineSession(SimpleImage image) {
		this(image, PipelineParameters.getDefault());
	}

	/**
	 * Create a session.
	 * @param image grayscale image, with values normalized to the range 0-1
	 * @param params
	 */
	public PipelineSession(SimpleImage image, PipelineParameters params) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		this.image = SimpleImages.unmodifiable(SimpleImages.copy(image));
		this.params = params;
	}

	/**
	 * Get the image being processed.
	 * @return a read-only image
	 */
	public SimpleImage getImage() {
		return image;
	}

	/**
	 * Get the current parameters.
	 * @return
	 */
	public PipelineParameters getParameters() {
		return params;
	}

	/**
	 * Replace all parameters, discarding only the results affected by the changes.
	 * @param params
	 */
	public void setParameters(PipelineParameters params) {
		Objects.requireNonNull(params, "Parameters must not be null");
		PipelineParameters previous = this.params;
		this.params = params;
		if (!Objects.equals(previous.getScaleBarRegion(), params.getScaleBarRegion()) ||
				previous.getScaleBarLength() != params.getScaleBarLength())
			invalidateCalibration();
		if (previous.getThreshold() != params.getThreshold() || previous.doRepair() != params.doRepair())
			invalidate(Stage.MASK);
		else if (previous.getMarkerQuantile() != params.getMarkerQuantile())
			invalidate(Stage.MARKERS);
		else if (previous.getBorderWidth() != params.getBorderWidth())
			invalidate(Stage.BORDER);
		else if (previous.getMinSize() != params.getMinSize() || previous.getMaxSize() != params.getMaxSize())
			invalidate(Stage.SIZES);
	}

	/**
	 * Set the binarization threshold.
	 * @param threshold
	 * @param repair
	 */
	public void setThreshold(double threshold, boolean repair) {
		setParameters(params.toBuilder().threshold(threshold).repair(repair).build());
	}

	/**
	 * Set the scale bar region and its physical length.
	 * @param region
	 * @param length
	 */
	public void setScaleBar(ImageRegion region, double length) {
		setParameters(params.toBuilder().scaleBarRegion(region).scaleBarLength(length).build());
	}

	/**
	 * Set the marker quantile.
	 * @param quantile
	 */
	public void setMarkerQuantile(double quantile) {
		setParameters(params.toBuilder().markerQuantile(quantile).build());
	}

	/**
	 * Set the width of the border band.
	 * @param width
	 */
	public void setBorderWidth(int width) {
		setParameters(params.toBuilder().borderWidth(width).build());
	}

	/**
	 * Set the accepted size range.
	 * @param minSize
	 * @param maxSize
	 */
	public void setSizeRange(double minSize, double maxSize) {
		setParameters(params.toBuilder().sizeRange(minSize, maxSize).build());
	}

	/**
	 * Discard the cached result of a stage and every stage after it.
	 * @param stage
	 */
	public void invalidate(Stage stage) {
		logger.debug("Invalidating results from {}", stage);
		switch (stage) {
		case MASK:
			mask = null;
		case DISTANCE:
			distanceField = null;
		case MARKERS:
			markers = null;
		case WATERSHED:
			labels = null;
		case BORDER:
			filteredLabels = null;
		case SIZES:
			sizeDistribution = null;
		}
	}

	private void invalidateCalibration() {
		logger.debug("Invalidating scale calibration");
		calibration = null;
		sizeDistribution = null;
	}

	/**
	 * Check whether the result of a stage is currently cached.
	 * @param stage
	 * @return
	 */
	public boolean isComputed(Stage stage) {
		switch (stage) {
		case MASK:
			return mask != null;
		case DISTANCE:
			return distanceField != null;
		case MARKERS:
			return markers != null;
		case WATERSHED:
			return labels != null;
		case BORDER:
			return filteredLabels != null;
		case SIZES:
			return sizeDistribution != null;
		default:
			return false;
		}
	}

	/**
	 * Check whether the scale calibration is currently cached.
	 * @return
	 */
	public boolean isCalibrated() {
		return calibration != null;
	}

	/**
	 * Get the scale calibration.
	 * @return
	 * @throws SegmentationException if no scale bar is selected, or the scale bar cannot be measured
	 */
	public ScaleCalibration.Result getCalibration() throws SegmentationException {
		if (calibration == null) {
			ImageRegion region = params.getScaleBarRegion();
			if (region == null)
				throw new EmptySelectionException("No scale bar region has been selected");
			calibration = ScaleCalibration.calibrate(image, region, params.getScaleBarLength());
			logger.info("Pixel size: {} {}", calibration.getPixelSize(), params.getUnit());
		}
		return calibration;
	}

	/**
	 * Get the physical size of one pixel.
	 * @return
	 * @throws SegmentationException if no scale bar is selected, or the scale bar cannot be measured
	 */
	public double getPixelSize() throws SegmentationException {
		return getCalibration().getPixelSize();
	}

	/**
	 * Get the binary mask of nanocrystal pixels.
	 * @return
	 */
	public BinaryMask getMask() {
		if (mask == null)
			mask = Thresholding.binarize(image, params.getThreshold(), params.doRepair());
		return mask;
	}

	/**
	 * Get the distance of each pixel to the background.
	 * @return
	 */
	public SimpleImage getDistanceField() {
		if (distanceField == null)
			distanceField = DistanceTransform.distanceField(getMask());
		return distanceField;
	}

	/**
	 * Get the watershed markers.
	 * @return
	 */
	public LabelImage getMarkers() {
		if (markers == null)
			markers = MarkerExtraction.extractMarkers(getDistanceField(), params.getMarkerQuantile());
		return markers;
	}

	/**
	 * Get the distribution of distances to the background, in physical units.
	 * @param nBins
	 * @return
	 * @throws SegmentationException if the pixel size is not available
	 */
	public DistanceDistribution getDistanceDistribution(int nBins) throws SegmentationException {
		return DistanceDistribution.compute(getDistanceField(), getPixelSize(), params.getMarkerQuantile(), nBins);
	}

	/**
	 * Get the watershed segmentation, before border filtering.
	 * @return
	 */
	public LabelImage getLabels() {
		if (labels == null) {
			try {
				labels = Watershed.watershed(getDistanceField(), getMarkers(), getMask());
			} catch (DimensionMismatchException e) {
				// All inputs are derived from the same image
				throw new IllegalStateException(e);
			}
			logger.info("Watershed found {} segments", labels.nLabels());
		}
		return labels;
	}

	/**
	 * Get the segmentation after removing segments near the image border.
	 * @return
	 */
	public LabelImage getFilteredLabels() {
		if (filteredLabels == null)
			filteredLabels = BorderFiltering.filterBorder(getLabels(), params.getBorderWidth());
		return filteredLabels;
	}

	/**
	 * Get the sizes of the remaining segments, and the normal distribution fitted to them.
	 * @return
	 * @throws SegmentationException if the pixel size is not available, or no segment has an acceptable size
	 */
	public SizeDistribution getSizeDistribution() throws SegmentationException {
		if (sizeDistribution == null) {
			double pixelSize = getPixelSize();
			sizeDistribution = SizeEstimation.estimateSizes(getFilteredLabels(), pixelSize, params.getMinSize(), params.getMaxSize());
			logger.info(sizeDistribution.getSummary(params.getUnit()));
		}
		return sizeDistribution;
	}

}
