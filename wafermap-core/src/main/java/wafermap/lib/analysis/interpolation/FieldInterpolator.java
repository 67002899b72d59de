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

package wafermap.lib.analysis.interpolation;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.analysis.boundary.ExtendedSampleSet;
import wafermap.lib.exceptions.InterpolationException;
import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;

/**
 * Static methods to fit a smooth field through an {@link ExtendedSampleSet} and evaluate it on a regular grid.
 * <p>
 * The grid spans the bounding box of the samples, with x and y ranges computed independently.
 * 
 * @author WaferMap developers
 */
public class FieldInterpolator {
	
	private static final Logger logger = LoggerFactory.getLogger(FieldInterpolator.class);
	
	/**
	 * Default grid resolution.
	 */
	public static final ImmutableDimension DEFAULT_RESOLUTION = ImmutableDimension.getInstance(100, 100);
	
	/**
	 * Minimum number of distinct, non-collinear points needed to define a 2D field.
	 */
	public static final int MIN_POINTS = 3;
	
	// Suppressed default constructor for non-instantiability
	private FieldInterpolator() {
		throw new AssertionError();
	}
	
	/**
	 * Interpolate with a thin-plate spline on a {@link #DEFAULT_RESOLUTION} grid.
	 * @param extended
	 * @return
	 * @throws InterpolationException if the samples are degenerate
	 */
	public static InterpolatedField interpolate(ExtendedSampleSet extended) throws InterpolationException {
		return interpolate(extended, DEFAULT_RESOLUTION);
	}
	
	/**
	 * Interpolate with a thin-plate spline.
	 * @param extended
	 * @param resolution grid width and height
	 * @return
	 * @throws InvalidInputException if the resolution is invalid
	 * @throws InterpolationException if the samples are degenerate
	 */
	public static InterpolatedField interpolate(ExtendedSampleSet extended, ImmutableDimension resolution) 
			throws InvalidInputException, InterpolationException {
		return interpolate(extended, resolution, RadialBasisFunction.THIN_PLATE, 0);
	}
	
	/**
	 * Interpolate with a specified radial basis function.
	 * 
	 * @param extended samples to interpolate
	 * @param resolution grid width and height
	 * @param function radial basis function
	 * @param smooth smoothing; 0 for an interpolant passing exactly through all samples
	 * @return
	 * @throws InvalidInputException if the resolution is invalid
	 * @throws InterpolationException if there are too few distinct points, the points are collinear, or the fit is singular
	 */
	public static InterpolatedField interpolate(ExtendedSampleSet extended, ImmutableDimension resolution, RadialBasisFunction function, double smooth) 
			throws InvalidInputException, InterpolationException {
		Objects.requireNonNull(extended, "Samples must not be null");
		if (resolution == null || resolution.getWidth() < 1 || resolution.getHeight() < 1)
			throw new InvalidInputException("Grid resolution must be at least 1x1, but was " + resolution);
		
		var samples = extended.getSamples();
		double[] xs = samples.getXs();
		double[] ys = samples.getYs();
		double[] values = samples.getValues();
		
		if (xs.length < MIN_POINTS)
			throw new InterpolationException("At least " + MIN_POINTS + " points are needed to interpolate a field, but only " + xs.length + " available");
		for (int i = 0; i < xs.length; i++) {
			if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i]))
				throw new InterpolationException(String.format("Sample %d has non-finite coordinates (%s, %s)", i, xs[i], ys[i]));
		}
		checkNotCollinear(xs, ys);

		var interpolator = RbfInterpolator.fit(xs, ys, values, function, Double.NaN, smooth);
		
		var grid = InterpolationGrid.create(min(xs), max(xs), min(ys), max(ys), resolution);
		int width = grid.getWidth();
		int height = grid.getHeight();
		double[] fieldValues = new double[width * height];
		for (int r = 0; r < height; r++) {
			double y = grid.getY(r);
			for (int c = 0; c < width; c++) {
				fieldValues[r * width + c] = interpolator.evaluate(grid.getX(c), y);
			}
		}
		var field = new Field(width, height, fieldValues);
		if (!field.isFinite())
			throw new InterpolationException("Interpolated field contains non-finite values");
		
		logger.debug("Interpolated {} samples onto {}", xs.length, grid);
		return new InterpolatedField(extended, grid, field, interpolator);
	}
	
	/**
	 * Throw an exception if all points lie on a single line (including when all points coincide).
	 */
	static void checkNotCollinear(double[] xs, double[] ys) throws InterpolationException {
		int n = xs.length;
		double x0 = xs[0], y0 = ys[0];
		// Find the point furthest from the first, to define a direction
		int ind = -1;
		double maxDistSq = 0;
		for (int i = 1; i < n; i++) {
			double dx = xs[i] - x0;
			double dy = ys[i] - y0;
			double d = dx*dx + dy*dy;
			if (d > maxDistSq) {
				maxDistSq = d;
				ind = i;
			}
		}
		if (ind < 0)
			throw new InterpolationException("All " + n + " points are coincident - cannot interpolate a field");
		double ux = xs[ind] - x0;
		double uy = ys[ind] - y0;
		double tol = 1e-12 * maxDistSq;
		for (int i = 1; i < n; i++) {
			double cross = ux * (ys[i] - y0) - uy * (xs[i] - x0);
			if (Math.abs(cross) > tol)
				return;
		}
		throw new InterpolationException("All " + n + " points are collinear - cannot interpolate a 2D field");
	}
	
	private static double min(double[] arr) {
		double min = Double.POSITIVE_INFINITY;
		for (double v : arr)
			min = Math.min(min, v);
		return min;
	}
	
	private static double max(double[] arr) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : arr)
			max = Math.max(max, v);
		return max;
	}

}
