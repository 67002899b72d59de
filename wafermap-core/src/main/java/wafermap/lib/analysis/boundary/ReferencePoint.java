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

package wafermap.lib.analysis.boundary;

import wafermap.lib.geom.Point2;

/**
 * The four fixed points on the wafer boundary where values are synthesized.
 * <p>
 * The declaration order is the order in which boundary samples are appended.
 * 
 * @author WaferMap developers
 */
public enum ReferencePoint {
	
	/**
	 * (0, R)
	 */
	TOP(0, 1),
	/**
	 * (0, -R)
	 */
	BOTTOM(0, -1),
	/**
	 * (R, 0)
	 */
	RIGHT(1, 0),
	/**
	 * (-R, 0)
	 */
	LEFT(-1, 0);
	
	private final int dx;
	private final int dy;
	
	ReferencePoint(int dx, int dy) {
		this.dx = dx;
		this.dy = dy;
	}
	
	/**
	 * Get the location of this reference point for a boundary circle of the given radius.
	 * @param radius
	 * @return
	 */
	public Point2 getLocation(double radius) {
		return new Point2(dx * radius, dy * radius);
	}

}
