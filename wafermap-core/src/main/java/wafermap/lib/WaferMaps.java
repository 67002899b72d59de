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

import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.analysis.boundary.BoundaryExtender;
import wafermap.lib.analysis.interpolation.FieldInterpolator;
import wafermap.lib.analysis.interpolation.InterpolatedField;
import wafermap.lib.analysis.interpolation.RadialBasisFunction;
import wafermap.lib.exceptions.InterpolationException;
import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.exceptions.RenderException;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.measurements.SampleList;
import wafermap.lib.regions.WaferGeometry;
import wafermap.lib.render.RenderRequest;
import wafermap.lib.render.WaferMapRenderer;

/**
 * Static methods to compute and draw wafer maps.
 * <p>
 * A wafer map is computed in two steps: samples are first extended with values on the wafer 
 * boundary (see {@link BoundaryExtender}), then a smooth field is fitted through them and 
 * evaluated on a regular grid (see {@link FieldInterpolator}). 
 * Drawing is delegated to a {@link WaferMapRenderer}.
 * <p>
 * Every call is independent: nothing is cached between calls.
 * 
 * @author WaferMap developers
 */
public class WaferMaps {
	
	private static final Logger logger = LoggerFactory.getLogger(WaferMaps.class);
	
	// Suppressed default constructor for non-instantiability
	private WaferMaps() {
		throw new AssertionError();
	}
	
	/**
	 * Compute the interpolated field for a wafer, using a thin-plate spline on a 100x100 grid.
	 * 
	 * @param x sample x coordinates
	 * @param y sample y coordinates
	 * @param v sample values
	 * @param waferSize wafer size (diameter); boundary values are synthesized at radius {@code waferSize/2}
	 * @return the grid, field and extended samples
	 * @throws InvalidInputException if the arrays are null, empty or of different lengths, or the wafer size is not positive
	 * @throws InterpolationException if the samples are degenerate
	 */
	public static InterpolatedField computeField(double[] x, double[] y, double[] v, double waferSize) 
			throws InvalidInputException, InterpolationException {
		return computeField(x, y, v, waferSize, FieldInterpolator.DEFAULT_RESOLUTION);
	}
	
	/**
	 * Compute the interpolated field for a wafer, using a thin-plate spline.
	 * 
	 * @param x sample x coordinates
	 * @param y sample y coordinates
	 * @param v sample values
	 * @param waferSize wafer size (diameter); boundary values are synthesized at radius {@code waferSize/2}
	 * @param resolution grid width and height
	 * @return the grid, field and extended samples
	 * @throws InvalidInputException if the arrays are null, empty or of different lengths, the wafer size is not positive, 
	 *                               or the resolution is invalid
	 * @throws InterpolationException if the samples are degenerate
	 */
	public static InterpolatedField computeField(double[] x, double[] y, double[] v, double waferSize, ImmutableDimension resolution) 
			throws InvalidInputException, InterpolationException {
		// Validate everything before doing any work
		var samples = SampleList.create(x, y, v);
		if (samples.isEmpty())
			throw new InvalidInputException("x, y and value arrays must not be empty");
		var geometry = WaferGeometry.fromSize(waferSize);
		if (resolution == null || resolution.getWidth() < 1 || resolution.getHeight() < 1)
			throw new InvalidInputException("Grid resolution must be at least 1x1, but was " + resolution);
		return computeField(samples, geometry, resolution, RadialBasisFunction.THIN_PLATE, 0);
	}
	
	/**
	 * Compute the interpolated field for a wafer using the specified parameters.
	 * 
	 * @param samples measured samples
	 * @param params geometry, resolution and interpolation settings
	 * @return the grid, field and extended samples
	 * @throws InvalidInputException if there are no samples
	 * @throws InterpolationException if the samples are degenerate
	 */
	public static InterpolatedField computeField(SampleList samples, WaferMapParameters params) 
			throws InvalidInputException, InterpolationException {
		Objects.requireNonNull(params, "Parameters must not be null");
		if (samples == null || samples.isEmpty())
			throw new InvalidInputException("At least one sample is required");
		return computeField(samples, params.getGeometry(), params.getResolution(), params.getFunction(), params.getSmooth());
	}
	
	private static InterpolatedField computeField(SampleList samples, WaferGeometry geometry, ImmutableDimension resolution, 
			RadialBasisFunction function, double smooth) {
		logger.debug("Computing field for {} samples ({}, grid {}, {})", samples.size(), geometry, resolution, function);
		var extended = BoundaryExtender.extend(samples, geometry.getRadius());
		return FieldInterpolator.interpolate(extended, resolution, function, smooth);
	}
	
	/**
	 * Compute a wafer map and pass it to a renderer.
	 * <p>
	 * If no display range is set in the parameters, the range of the extended sample values is used.
	 * 
	 * @param samples measured samples
	 * @param params computation and display settings
	 * @param renderer renderer responsible for drawing and writing the map
	 * @param output destination file
	 * @return the computed field
	 * @throws InvalidInputException if there are no samples
	 * @throws InterpolationException if the samples are degenerate
	 * @throws RenderException if the renderer fails, or the display range is invalid
	 */
	public static InterpolatedField drawMapContour(SampleList samples, WaferMapParameters params, WaferMapRenderer renderer, Path output) 
			throws InvalidInputException, InterpolationException, RenderException {
		Objects.requireNonNull(renderer, "Renderer must not be null");
		Objects.requireNonNull(output, "Output must not be null");
		var result = computeField(samples, params);
		var extended = result.getSamples().getSamples();
		var request = RenderRequest.builder()
				.field(result)
				.samples(samples)
				.clip(params.getGeometry().getClipRegion())
				.vmin(params.getVmin())
				.vmax(params.getVmax())
				.colorMap(params.getColorMapName())
				.output(output)
				.build(extended.getMinValue(), extended.getMaxValue());
		renderer.render(request);
		logger.info("Wafer map for {} samples written to {}", samples.size(), output);
		return result;
	}

}
