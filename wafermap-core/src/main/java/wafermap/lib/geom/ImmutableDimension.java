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

package wafermap.lib.geom;

/**
 * An immutable width and height, used for grid resolutions and image sizes.
 * 
 * @author WaferMap developers
 *
 */
public class ImmutableDimension {
	
	/**
	 * Width of the ImmutableDimension.
	 */
	final public int width;
	
	/**
	 * Height of the ImmutableDimension.
	 */
	final public int height;
	
	private ImmutableDimension(final int width, final int height) {
		this.width = width;
		this.height = height;
	}
	
	/**
	 * Get an ImmutableDimension representing the specified width and height.
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImmutableDimension getInstance(final int width, final int height) {
		return new ImmutableDimension(width, height);
	}
	
	/**
	 * Parse a dimension from a string of the form "100x80" (or "100,80").
	 * A single number is used for both width and height.
	 * @param text
	 * @return
	 * @throws NumberFormatException if the text cannot be parsed
	 */
	public static ImmutableDimension parse(final String text) {
		String[] split = text.trim().split("\\s*[xX,]\\s*");
		if (split.length == 1) {
			int n = Integer.parseInt(split[0]);
			return getInstance(n, n);
		}
		if (split.length != 2)
			throw new NumberFormatException("Dimension must be given as WIDTHxHEIGHT, but was " + text);
		return getInstance(Integer.parseInt(split[0]), Integer.parseInt(split[1]));
	}
	
	/**
	 * Get the ImmutableDimension width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Get the ImmutableDimension height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	@Override
	public int hashCode() {
		return 31 * width + height;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImmutableDimension))
			return false;
		ImmutableDimension other = (ImmutableDimension) obj;
		return width == other.width && height == other.height;
	}
	
	@Override
	public String toString() {
		return width + "x" + height;
	}
	
}
