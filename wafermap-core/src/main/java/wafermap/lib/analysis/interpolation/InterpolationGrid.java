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

import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;

/**
 * Regular lattice of evaluation coordinates spanning a rectangle.
 * <p>
 * Coordinates are linearly spaced along each axis, with the first and last coordinates 
 * equal to the bounds. Column indices run along x, row indices along y.
 * 
 * @author WaferMap developers
 */
public class InterpolationGrid {
	
	private final double xMin, xMax, yMin, yMax;
	private final double[] xs;
	private final double[] ys;
	
	private InterpolationGrid(double xMin, double xMax, double yMin, double yMax, int width, int height) {
		this.xMin = xMin;
		this.xMax = xMax;
		this.yMin = yMin;
		this.yMax = yMax;
		this.xs = linspace(xMin, xMax, width);
		this.ys = linspace(yMin, yMax, height);
	}
	
	/**
	 * Create a grid spanning {@code [xMin, xMax] x [yMin, yMax]}.
	 * @param xMin
	 * @param xMax
	 * @param yMin
	 * @param yMax
	 * @param resolution number of columns (width) and rows (height)
	 * @return
	 * @throws InvalidInputException if the bounds are not finite or ordered, or the resolution is &lt; 1
	 */
	public static InterpolationGrid create(double xMin, double xMax, double yMin, double yMax, ImmutableDimension resolution) 
			throws InvalidInputException {
		if (resolution == null || resolution.getWidth() < 1 || resolution.getHeight() < 1)
			throw new InvalidInputException("Grid resolution must be at least 1x1, but was " + resolution);
		if (!Double.isFinite(xMin) || !Double.isFinite(xMax) || !Double.isFinite(yMin) || !Double.isFinite(yMax))
			throw new InvalidInputException(String.format("Grid bounds must be finite (x %s-%s, y %s-%s)", xMin, xMax, yMin, yMax));
		if (xMin > xMax || yMin > yMax)
			throw new InvalidInputException(String.format("Grid bounds must be ordered (x %s-%s, y %s-%s)", xMin, xMax, yMin, yMax));
		return new InterpolationGrid(xMin, xMax, yMin, yMax, resolution.getWidth(), resolution.getHeight());
	}
	
	/**
	 * Create {@code n} evenly spaced values from {@code start} to {@code stop} inclusive.
	 * For {@code n == 1} the result contains only {@code start}.
	 * @param start
	 * @param stop
	 * @param n
	 * @return
	 */
	static double[] linspace(double start, double stop, int n) {
		double[] values = new double[n];
		if (n == 1) {
			values[0] = start;
			return values;
		}
		double step = (stop - start) / (n - 1);
		for (int i = 0; i < n; i++)
			values[i] = start + i * step;
		values[n-1] = stop;
		return values;
	}
	
	/**
	 * Number of columns.
	 * @return
	 */
	public int getWidth() {
		return xs.length;
	}
	
	/**
	 * Number of rows.
	 * @return
	 */
	public int getHeight() {
		return ys.length;
	}
	
	/**
	 * Grid dimensions.
	 * @return
	 */
	public ImmutableDimension getResolution() {
		return ImmutableDimension.getInstance(getWidth(), getHeight());
	}
	
	/**
	 * x coordinate of a column.
	 * @param col
	 * @return
	 */
	public double getX(int col) {
		return xs[col];
	}
	
	/**
	 * y coordinate of a row.
	 * @param row
	 * @return
	 */
	public double getY(int row) {
		return ys[row];
	}
	
	/**
	 * Get a copy of all column x coordinates.
	 * @return
	 */
	public double[] getXs() {
		return xs.clone();
	}
	
	/**
	 * Get a copy of all row y coordinates.
	 * @return
	 */
	public double[] getYs() {
		return ys.clone();
	}
	
	/**
	 * Minimum x.
	 * @return
	 */
	public double getMinX() {
		return xMin;
	}

	/**
	 * Maximum x.
	 * @return
	 */
	public double getMaxX() {
		return xMax;
	}

	/**
	 * Minimum y.
	 * @return
	 */
	public double getMinY() {
		return yMin;
	}

	/**
	 * Maximum y.
	 * @return
	 */
	public double getMaxY() {
		return yMax;
	}
	
	@Override
	public String toString() {
		return String.format("InterpolationGrid [%dx%d, x %s-%s, y %s-%s]", getWidth(), getHeight(), xMin, xMax, yMin, yMax);
	}

}
