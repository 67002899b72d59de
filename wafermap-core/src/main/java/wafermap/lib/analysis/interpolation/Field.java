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

import java.util.Arrays;

/**
 * Dense 2D array of interpolated values, one per grid point.
 * <p>
 * Values are stored row by row. Row 0 corresponds to the minimum y coordinate of the grid, 
 * column 0 to the minimum x coordinate.
 * 
 * @author WaferMap developers
 * @see InterpolationGrid
 */
public class Field {
	
	private final int width;
	private final int height;
	private final double[] values;
	
	Field(int width, int height, double[] values) {
		if (values.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " values, but got " + values.length);
		this.width = width;
		this.height = height;
		this.values = values;
	}
	
	/**
	 * Number of columns.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Number of rows.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the value at a specified column and row.
	 * @param col
	 * @param row
	 * @return
	 */
	public double getValue(int col, int row) {
		if (col < 0 || col >= width || row < 0 || row >= height)
			throw new IndexOutOfBoundsException(String.format("(%d, %d) is outside a %dx%d field", col, row, width, height));
		return values[row * width + col];
	}
	
	/**
	 * Get a copy of a single row.
	 * @param row
	 * @return
	 */
	public double[] getRow(int row) {
		return Arrays.copyOfRange(values, row * width, (row + 1) * width);
	}
	
	/**
	 * Get a copy of all values, as a {@code [height][width]} array.
	 * @return
	 */
	public double[][] toArray() {
		double[][] arr = new double[height][];
		for (int r = 0; r < height; r++)
			arr[r] = getRow(r);
		return arr;
	}
	
	/**
	 * Minimum finite value, or NaN if there are none.
	 * @return
	 */
	public double getMinValue() {
		return Arrays.stream(values).filter(Double::isFinite).min().orElse(Double.NaN);
	}
	
	/**
	 * Maximum finite value, or NaN if there are none.
	 * @return
	 */
	public double getMaxValue() {
		return Arrays.stream(values).filter(Double::isFinite).max().orElse(Double.NaN);
	}
	
	/**
	 * Returns true if all values are finite (no NaN or infinite values).
	 * @return
	 */
	public boolean isFinite() {
		for (double v : values) {
			if (!Double.isFinite(v))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(values);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Field))
			return false;
		Field other = (Field) obj;
		return width == other.width && height == other.height && Arrays.equals(values, other.values);
	}
	
	@Override
	public String toString() {
		return "Field [" + width + "x" + height + "]";
	}

}
