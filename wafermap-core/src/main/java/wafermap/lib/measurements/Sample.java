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

package wafermap.lib.measurements;

import java.util.Objects;

import wafermap.lib.geom.Point2;

/**
 * A single scalar measurement at a 2D coordinate.
 * 
 * @author WaferMap developers
 */
public class Sample {
	
	private final double x;
	private final double y;
	private final double value;
	
	private Sample(double x, double y, double value) {
		this.x = x;
		this.y = y;
		this.value = value;
	}
	
	/**
	 * Create a sample.
	 * @param x x coordinate
	 * @param y y coordinate
	 * @param value measured value
	 * @return
	 */
	public static Sample create(double x, double y, double value) {
		return new Sample(x, y, value);
	}
	
	/**
	 * Get the x coordinate.
	 * @return
	 */
	public double getX() {
		return x;
	}
	
	/**
	 * Get the y coordinate.
	 * @return
	 */
	public double getY() {
		return y;
	}
	
	/**
	 * Get the measured value.
	 * @return
	 */
	public double getValue() {
		return value;
	}
	
	/**
	 * Get the location of the sample as a point.
	 * @return
	 */
	public Point2 getLocation() {
		return new Point2(x, y);
	}
	
	/**
	 * Euclidean distance from this sample's location to (x, y).
	 * @param x
	 * @param y
	 * @return
	 */
	public double distance(double x, double y) {
		return getLocation().distance(x, y);
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Sample))
			return false;
		Sample other = (Sample) obj;
		return Double.doubleToLongBits(x) == Double.doubleToLongBits(other.x)
				&& Double.doubleToLongBits(y) == Double.doubleToLongBits(other.y)
				&& Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
	}

	@Override
	public String toString() {
		return "Sample [x=" + x + ", y=" + y + ", value=" + value + "]";
	}

}
