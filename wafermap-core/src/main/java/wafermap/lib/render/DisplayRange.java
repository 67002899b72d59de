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

package wafermap.lib.render;

import wafermap.lib.exceptions.RenderException;

/**
 * Range of values mapped onto a colormap when displaying a field.
 * <p>
 * This only affects presentation; field values are never clamped.
 * 
 * @author WaferMap developers
 */
public class DisplayRange {
	
	private final double min;
	private final double max;
	
	private DisplayRange(double min, double max) {
		this.min = min;
		this.max = max;
	}
	
	/**
	 * Create a display range.
	 * @param min value shown with the first colormap color
	 * @param max value shown with the last colormap color
	 * @return
	 * @throws RenderException if either value is not finite, or {@code min > max}
	 */
	public static DisplayRange create(double min, double max) throws RenderException {
		if (!Double.isFinite(min) || !Double.isFinite(max))
			throw new RenderException(String.format("Display range must be finite, but was %s - %s", min, max));
		if (min > max)
			throw new RenderException(String.format("Display range minimum (%s) must not exceed maximum (%s)", min, max));
		return new DisplayRange(min, max);
	}
	
	/**
	 * Minimum display value.
	 * @return
	 */
	public double getMin() {
		return min;
	}
	
	/**
	 * Maximum display value.
	 * @return
	 */
	public double getMax() {
		return max;
	}
	
	@Override
	public String toString() {
		return "DisplayRange [" + min + ", " + max + "]";
	}

}
