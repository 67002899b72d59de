/*-
 * #%L
 * This file is part of WaferMap.
 * %%
 * Copyright (C) 2024 WaferMap developers
 * %%
 * WaferMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * WaferMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with WaferMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package wafermap.lib;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.JsonParseException;

import wafermap.lib.analysis.interpolation.FieldInterpolator;
import wafermap.lib.analysis.interpolation.RadialBasisFunction;
import wafermap.lib.color.ColorMaps;
import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.io.GsonTools;
import wafermap.lib.regions.WaferGeometry;

/**
 * Settings controlling how a wafer map is computed and drawn.
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to create modified copies.
 * Parameters can also be read from and written to JSON, where any missing property keeps its default.
 * 
 * @author WaferMap developers
 */
public class WaferMapParameters {
	
	/**
	 * Default image width, in pixels.
	 */
	public static final int DEFAULT_IMAGE_WIDTH = 640;
	
	/**
	 * Default image height, in pixels.
	 */
	public static final int DEFAULT_IMAGE_HEIGHT = 480;
	
	private double waferSize = WaferGeometry.DEFAULT_SIZE;
	private int gridWidth = FieldInterpolator.DEFAULT_RESOLUTION.getWidth();
	private int gridHeight = FieldInterpolator.DEFAULT_RESOLUTION.getHeight();
	private RadialBasisFunction function = RadialBasisFunction.THIN_PLATE;
	private double smooth = 0;
	private Double vmin;
	private Double vmax;
	private String colorMap = ColorMaps.DEFAULT_COLORMAP_NAME;
	private int imageWidth = DEFAULT_IMAGE_WIDTH;
	private int imageHeight = DEFAULT_IMAGE_HEIGHT;
	private String outputDirectory = "";
	
	private WaferMapParameters() {}
	
	private WaferMapParameters(WaferMapParameters other) {
		this.waferSize = other.waferSize;
		this.gridWidth = other.gridWidth;
		this.gridHeight = other.gridHeight;
		this.function = other.function;
		this.smooth = other.smooth;
		this.vmin = other.vmin;
		this.vmax = other.vmax;
		this.colorMap = other.colorMap;
		this.imageWidth = other.imageWidth;
		this.imageHeight = other.imageHeight;
		this.outputDirectory = other.outputDirectory;
	}
	
	/**
	 * Get the default parameters.
	 * @return
	 */
	public static WaferMapParameters getDefault() {
		return new WaferMapParameters();
	}
	
	/**
	 * Wafer geometry (size and radius).
	 * @return
	 */
	public WaferGeometry getGeometry() {
		return WaferGeometry.fromSize(waferSize);
	}
	
	/**
	 * Wafer size (diameter).
	 * @return
	 */
	public double getWaferSize() {
		return waferSize;
	}
	
	/**
	 * Interpolation grid resolution.
	 * @return
	 */
	public ImmutableDimension getResolution() {
		return ImmutableDimension.getInstance(gridWidth, gridHeight);
	}
	
	/**
	 * Radial basis function used for interpolation.
	 * @return
	 */
	public RadialBasisFunction getFunction() {
		return function;
	}
	
	/**
	 * Interpolation smoothing (0 for exact interpolation).
	 * @return
	 */
	public double getSmooth() {
		return smooth;
	}
	
	/**
	 * Minimum display value, or null to use the minimum sample value.
	 * @return
	 */
	public Double getVmin() {
		return vmin;
	}
	
	/**
	 * Maximum display value, or null to use the maximum sample value.
	 * @return
	 */
	public Double getVmax() {
		return vmax;
	}
	
	/**
	 * Colormap name.
	 * @return
	 */
	public String getColorMapName() {
		return colorMap;
	}
	
	/**
	 * Output image size, in pixels.
	 * @return
	 */
	public ImmutableDimension getImageSize() {
		return ImmutableDimension.getInstance(imageWidth, imageHeight);
	}
	
	/**
	 * Directory images are written to; empty for the working directory.
	 * @return
	 */
	public String getOutputDirectory() {
		return outputDirectory;
	}
	
	/**
	 * Resolve a file name against the output directory.
	 * @param fileName
	 * @return
	 */
	public Path resolveOutput(String fileName) {
		if (outputDirectory == null || outputDirectory.isBlank())
			return Path.of(fileName);
		return Path.of(outputDirectory).resolve(fileName);
	}
	
	/**
	 * Create a builder initialized with these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(new WaferMapParameters(this));
	}
	
	/**
	 * Create a builder initialized with default parameters.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new WaferMapParameters());
	}
	
	/**
	 * Check all values are valid.
	 * The display range is not checked here: it is only resolved against the sample values 
	 * when a render request is built, and an inverted range fails there with a 
	 * {@link wafermap.lib.exceptions.RenderException}.
	 * @return these parameters
	 * @throws InvalidInputException if any value is invalid
	 */
	WaferMapParameters validate() throws InvalidInputException {
		WaferGeometry.fromSize(waferSize);
		if (gridWidth < 1 || gridHeight < 1)
			throw new InvalidInputException("Grid resolution must be at least 1x1, but was " + gridWidth + "x" + gridHeight);
		if (function == null)
			throw new InvalidInputException("Radial basis function must be specified");
		if (!Double.isFinite(smooth))
			throw new InvalidInputException("Smoothing must be finite, but was " + smooth);
		if (colorMap == null || colorMap.isBlank())
			throw new InvalidInputException("Colormap name must be specified");
		if (imageWidth < 1 || imageHeight < 1)
			throw new InvalidInputException("Image size must be at least 1x1, but was " + imageWidth + "x" + imageHeight);
		if (outputDirectory == null)
			outputDirectory = "";
		return this;
	}
	
	/**
	 * Serialize as JSON.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}
	
	/**
	 * Read parameters from JSON. Missing properties keep their default values.
	 * @param json
	 * @return
	 * @throws InvalidInputException if the JSON cannot be parsed, or contains invalid values
	 */
	public static WaferMapParameters fromJson(String json) throws InvalidInputException {
		WaferMapParameters params;
		try {
			params = GsonTools.getInstance().fromJson(json, WaferMapParameters.class);
		} catch (JsonParseException e) {
			throw new InvalidInputException("Unable to parse parameters: " + e.getLocalizedMessage(), e);
		}
		if (params == null)
			return getDefault();
		return params.validate();
	}
	
	/**
	 * Read parameters from a JSON file. Missing properties keep their default values.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read
	 * @throws InvalidInputException if the JSON cannot be parsed, or contains invalid values
	 */
	public static WaferMapParameters read(Path path) throws IOException, InvalidInputException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			WaferMapParameters params = GsonTools.getInstance().fromJson(reader, WaferMapParameters.class);
			if (params == null)
				return getDefault();
			return params.validate();
		} catch (JsonParseException e) {
			throw new InvalidInputException("Unable to parse parameters from " + path + ": " + e.getLocalizedMessage(), e);
		}
	}
	
	@Override
	public String toString() {
		return "WaferMapParameters " + GsonTools.getInstance().toJson(this);
	}
	
	/**
	 * Builder for {@link WaferMapParameters}.
	 */
	public static class Builder {
		
		private final WaferMapParameters params;
		
		private Builder(WaferMapParameters params) {
			this.params = params;
		}
		
		/**
		 * Set the wafer size (diameter).
		 * @param size
		 * @return this builder
		 */
		public Builder waferSize(double size) {
			params.waferSize = size;
			return this;
		}
		
		/**
		 * Set the interpolation grid resolution.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder resolution(int width, int height) {
			params.gridWidth = width;
			params.gridHeight = height;
			return this;
		}
		
		/**
		 * Set the radial basis function.
		 * @param function
		 * @return this builder
		 */
		public Builder function(RadialBasisFunction function) {
			params.function = function;
			return this;
		}
		
		/**
		 * Set the smoothing.
		 * @param smooth
		 * @return this builder
		 */
		public Builder smooth(double smooth) {
			params.smooth = smooth;
			return this;
		}
		
		/**
		 * Set the minimum display value.
		 * @param vmin minimum, or null to use the minimum sample value
		 * @return this builder
		 */
		public Builder vmin(Double vmin) {
			params.vmin = vmin;
			return this;
		}
		
		/**
		 * Set the maximum display value.
		 * @param vmax maximum, or null to use the maximum sample value
		 * @return this builder
		 */
		public Builder vmax(Double vmax) {
			params.vmax = vmax;
			return this;
		}
		
		/**
		 * Set the colormap name.
		 * @param name
		 * @return this builder
		 */
		public Builder colorMap(String name) {
			params.colorMap = name;
			return this;
		}
		
		/**
		 * Set the output image size.
		 * @param width
		 * @param height
		 * @return this builder
		 */
		public Builder imageSize(int width, int height) {
			params.imageWidth = width;
			params.imageHeight = height;
			return this;
		}
		
		/**
		 * Set the output directory.
		 * @param directory
		 * @return this builder
		 */
		public Builder outputDirectory(String directory) {
			params.outputDirectory = directory;
			return this;
		}
		
		/**
		 * Build the parameters.
		 * @return
		 * @throws InvalidInputException if any value is invalid
		 */
		public WaferMapParameters build() throws InvalidInputException {
			return new WaferMapParameters(params).validate();
		}
		
	}

}
