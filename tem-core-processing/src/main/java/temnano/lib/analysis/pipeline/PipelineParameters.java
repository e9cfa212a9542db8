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

import com.google.gson.JsonParseException;

import temnano.lib.common.GeneralTools;
import temnano.lib.io.GsonTools;
import temnano.lib.regions.ImageRegion;

/**
 * Parameters for all stages of the size distribution pipeline.
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to create new parameters.
 * They can be stored as JSON with {@link #toJson()} and read back with {@link #fromJson(String)}; missing
 * properties take their default values.
 */
public class PipelineParameters {

	/**
	 * Default binarization threshold.
	 */
	public static final double DEFAULT_THRESHOLD = 0.5;

	/**
	 * Default physical length of the scale bar.
	 */
	public static final double DEFAULT_SCALE_BAR_LENGTH = 100.0;

	/**
	 * Default marker quantile.
	 */
	public static final double DEFAULT_MARKER_QUANTILE = 0.9;

	/**
	 * Default width of the border band, in pixels.
	 */
	public static final int DEFAULT_BORDER_WIDTH = 10;

	/**
	 * Default minimum size (exclusive).
	 */
	public static final double DEFAULT_MIN_SIZE = 0.0;

	/**
	 * Default maximum size (exclusive).
	 */
	public static final double DEFAULT_MAX_SIZE = 20.0;

	/**
	 * Default physical unit.
	 */
	public static final String DEFAULT_UNIT = "nm";

	private double threshold = DEFAULT_THRESHOLD;
	private boolean repair = false;
	private ImageRegion scaleBarRegion;
	private double scaleBarLength = DEFAULT_SCALE_BAR_LENGTH;
	private double markerQuantile = DEFAULT_MARKER_QUANTILE;
	private int borderWidth = DEFAULT_BORDER_WIDTH;
	private double minSize = DEFAULT_MIN_SIZE;
	private double maxSize = DEFAULT_MAX_SIZE;
	private String unit = DEFAULT_UNIT;

	// Also used by Gson, so that missing properties keep their defaults
	private PipelineParameters() {}

	private PipelineParameters(PipelineParameters params) {
		this.threshold = params.threshold;
		this.repair = params.repair;
		this.scaleBarRegion = params.scaleBarRegion;
		this.scaleBarLength = params.scaleBarLength;
		this.markerQuantile = params.markerQuantile;
		this.borderWidth = params.borderWidth;
		this.minSize = params.minSize;
		this.maxSize = params.maxSize;
		this.unit = params.unit;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static PipelineParameters getDefault() {
		return new PipelineParameters();
	}

	/**
	 * Create a builder initialized with the default parameters.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new PipelineParameters());
	}

	/**
	 * Create a builder initialized with these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(new PipelineParameters(this));
	}

	/**
	 * Binarization threshold; pixels below it are nanocrystals.
	 * @return
	 */
	public double getThreshold() {
		return threshold;
	}

	/**
	 * Whether the binary mask should be repaired by region growing.
	 * @return
	 */
	public boolean doRepair() {
		return repair;
	}

	/**
	 * Region containing the scale bar, or null if it has not been selected.
	 * @return
	 */
	public ImageRegion getScaleBarRegion() {
		return scaleBarRegion;
	}

	/**
	 * Physical length of the scale bar.
	 * @return
	 */
	public double getScaleBarLength() {
		return scaleBarLength;
	}

	/**
	 * Quantile of the distance field used to find markers.
	 * @return
	 */
	public double getMarkerQuantile() {
		return markerQuantile;
	}

	/**
	 * Width of the border band, in pixels.
	 * @return
	 */
	public int getBorderWidth() {
		return borderWidth;
	}

	/**
	 * Minimum accepted size (exclusive), in physical units.
	 * @return
	 */
	public double getMinSize() {
		return minSize;
	}

	/**
	 * Maximum accepted size (exclusive), in physical units.
	 * @return
	 */
	public double getMaxSize() {
		return maxSize;
	}

	/**
	 * Physical unit of the scale bar length and the sizes.
	 * @return
	 */
	public String getUnit() {
		return unit;
	}

	/**
	 * Write the parameters as pretty-printed JSON.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}

	/**
	 * Read parameters from JSON.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON cannot be parsed
	 * @throws IllegalArgumentException if any parameter is invalid
	 */
	public static PipelineParameters fromJson(String json) {
		Objects.requireNonNull(json, "JSON must not be null");
		PipelineParameters params = GsonTools.getInstance().fromJson(json, PipelineParameters.class);
		if (params == null)
			return getDefault();
		if (params.unit == null)
			params.unit = DEFAULT_UNIT;
		params.validate();
		return params;
	}

	private void validate() {
		if (!(threshold >= 0 && threshold <= 1))
			throw new IllegalArgumentException("Threshold must be between 0 and 1, but was " + threshold);
		if (!(Double.isFinite(scaleBarLength) && scaleBarLength > 0))
			throw new IllegalArgumentException("Scale bar length must be a finite value > 0, but was " + scaleBarLength);
		if (!(markerQuantile >= 0 && markerQuantile <= 1))
			throw new IllegalArgumentException("Marker quantile must be between 0 and 1, but was " + markerQuantile);
		if (borderWidth < 0)
			throw new IllegalArgumentException("Border width must be >= 0, but was " + borderWidth);
		if (Double.isNaN(minSize) || Double.isNaN(maxSize) || minSize > maxSize)
			throw new IllegalArgumentException("Invalid size range " + minSize + " - " + maxSize);
		if (GeneralTools.blankString(unit, true))
			throw new IllegalArgumentException("Unit must not be blank");
	}

	@Override
	public int hashCode() {
		return Objects.hash(borderWidth, markerQuantile, maxSize, minSize, repair, scaleBarLength, scaleBarRegion,
				threshold, unit);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PipelineParameters))
			return false;
		PipelineParameters other = (PipelineParameters) obj;
		return borderWidth == other.borderWidth
				&& Double.doubleToLongBits(markerQuantile) == Double.doubleToLongBits(other.markerQuantile)
				&& Double.doubleToLongBits(maxSize) == Double.doubleToLongBits(other.maxSize)
				&& Double.doubleToLongBits(minSize) == Double.doubleToLongBits(other.minSize)
				&& repair == other.repair
				&& Double.doubleToLongBits(scaleBarLength) == Double.doubleToLongBits(other.scaleBarLength)
				&& Objects.equals(scaleBarRegion, other.scaleBarRegion)
				&& Double.doubleToLongBits(threshold) == Double.doubleToLongBits(other.threshold)
				&& Objects.equals(unit, other.unit);
	}

	@Override
	public String toString() {
		return "PipelineParameters [threshold=" + threshold + ", repair=" + repair + ", scaleBarRegion="
				+ scaleBarRegion + ", scaleBarLength=" + scaleBarLength + ", markerQuantile=" + markerQuantile
				+ ", borderWidth=" + borderWidth + ", minSize=" + minSize + ", maxSize=" + maxSize + ", unit=" + unit
				+ "]";
	}


	/**
	 * Builder for {@link PipelineParameters}.
	 */
	public static class Builder {

		private final PipelineParameters params;

		private Builder(PipelineParameters params) {
			this.params = params;
		}

		/**
		 * Set the binarization threshold, in the range 0-1.
		 * @param threshold
		 * @return this builder
		 */
		public Builder threshold(double threshold) {
			params.threshold = threshold;
			return this;
		}

		/**
		 * Set whether the mask should be repaired by region growing.
		 * @param repair
		 * @return this builder
		 */
		public Builder repair(boolean repair) {
			params.repair = repair;
			return this;
		}

		/**
		 * Set the region containing the scale bar.
		 * @param region
		 * @return this builder
		 */
		public Builder scaleBarRegion(ImageRegion region) {
			params.scaleBarRegion = region;
			return this;
		}

		/**
		 * Set the physical length of the scale bar.
		 * @param length
		 * @return this builder
		 */
		public Builder scaleBarLength(double length) {
			params.scaleBarLength = length;
			return this;
		}

		/**
		 * Set the marker quantile, in the range 0-1.
		 * @param quantile
		 * @return this builder
		 */
		public Builder markerQuantile(double quantile) {
			params.markerQuantile = quantile;
			return this;
		}

		/**
		 * Set the width of the border band, in pixels.
		 * @param width
		 * @return this builder
		 */
		public Builder borderWidth(int width) {
			params.borderWidth = width;
			return this;
		}

		/**
		 * Set the accepted size range (both exclusive).
		 * @param minSize
		 * @param maxSize
		 * @return this builder
		 */
		public Builder sizeRange(double minSize, double maxSize) {
			params.minSize = minSize;
			params.maxSize = maxSize;
			return this;
		}

		/**
		 * Set the physical unit.
		 * @param unit
		 * @return this builder
		 */
		public Builder unit(String unit) {
			params.unit = unit;
			return this;
		}

		/**
		 * Build the parameters.
		 * @return
		 * @throws IllegalArgumentException if any parameter is invalid
		 */
		public PipelineParameters build() {
			params.validate();
			return new PipelineParameters(params);
		}

	}

}
