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

package wafermap.lib.regions;

import wafermap.lib.exceptions.InvalidInputException;

/**
 * Circular clip region centered at the origin.
 * <p>
 * This is only geometry used when displaying a field; it does not modify any computed values.
 * 
 * @author WaferMap developers
 */
public class ClipRegion {
	
	private final double centerX = 0;
	private final double centerY = 0;
	private final double radius;
	
	private ClipRegion(double radius) {
		this.radius = radius;
	}
	
	/**
	 * Create a circular clip region at the origin.
	 * @param radius
	 * @return
	 * @throws InvalidInputException if the radius is not finite and positive
	 */
	public static ClipRegion createCircle(double radius) throws InvalidInputException {
		if (!Double.isFinite(radius) || radius <= 0)
			throw new InvalidInputException("Clip radius must be finite and > 0, but was " + radius);
		return new ClipRegion(radius);
	}
	
	/**
	 * x coordinate of the circle center (always 0).
	 * @return
	 */
	public double getCenterX() {
		return centerX;
	}

	/**
	 * y coordinate of the circle center (always 0).
	 * @return
	 */
	public double getCenterY() {
		return centerY;
	}
	
	/**
	 * Circle radius.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}
	
	/**
	 * Returns true if (x, y) lies inside or on the circle.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(double x, double y) {
		double dx = x - centerX;
		double dy = y - centerY;
		return dx*dx + dy*dy <= radius*radius;
	}
	
	@Override
	public String toString() {
		return "ClipRegion [circle, radius=" + radius + "]";
	}

}
