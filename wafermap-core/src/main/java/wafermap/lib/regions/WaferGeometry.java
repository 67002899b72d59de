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
 * Size of a (circular) wafer, centered at the origin.
 * <p>
 * Sizes are given as diameters, in the same units as the sample coordinates.
 * The radius defines both the boundary reference points and the clip circle.
 * 
 * @author WaferMap developers
 */
public class WaferGeometry {
	
	/**
	 * Default wafer size (diameter).
	 */
	public static final double DEFAULT_SIZE = 300;
	
	private final double size;
	
	private WaferGeometry(double size) {
		this.size = size;
	}
	
	/**
	 * Create a geometry from the wafer size (diameter).
	 * @param size
	 * @return
	 * @throws InvalidInputException if the size is not finite and positive
	 */
	public static WaferGeometry fromSize(double size) throws InvalidInputException {
		if (!Double.isFinite(size) || size <= 0)
			throw new InvalidInputException("Wafer size must be finite and > 0, but was " + size);
		return new WaferGeometry(size);
	}
	
	/**
	 * Get the default geometry (300 diameter).
	 * @return
	 */
	public static WaferGeometry getDefault() {
		return new WaferGeometry(DEFAULT_SIZE);
	}
	
	/**
	 * Wafer size (diameter).
	 * @return
	 */
	public double getSize() {
		return size;
	}
	
	/**
	 * Wafer radius.
	 * @return
	 */
	public double getRadius() {
		return size / 2.0;
	}
	
	/**
	 * Circle used to clip the displayed field.
	 * @return
	 */
	public ClipRegion getClipRegion() {
		return ClipRegion.createCircle(getRadius());
	}
	
	@Override
	public int hashCode() {
		return Double.hashCode(size);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof WaferGeometry))
			return false;
		return Double.doubleToLongBits(size) == Double.doubleToLongBits(((WaferGeometry)obj).size);
	}

	@Override
	public String toString() {
		return "WaferGeometry [size=" + size + "]";
	}

}
