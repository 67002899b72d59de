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

package wafermap.lib.common;

/**
 * Static functions to help work with RGB(A) colors using packed ints.
 * 
 * @author WaferMap developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing white.
	 */
	final public static int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed int representing black.
	 */
	final public static int BLACK = packRGB(0, 0, 0);

	/**
	 * Mask for use when extracting the red component from a packed (A)RGB int value.
	 */
	final public static int MASK_RED = 0xff0000;
	
	/**
	 * Mask for use when extracting the green component from a packed (A)RGB int value.
	 */
	final public static int MASK_GREEN = 0xff00;
	
	/**
	 * Mask for use when extracting the blue component from a packed (A)RGB int value.
	 */
	final public static int MASK_BLUE = 0xff;
	
	/**
	 * Make a packed RGB value from specified input values.
	 * <p>
	 * Input r, g and b should be in the range 0-255 - but no checking is applied.
	 * The alpha value is 255.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 * @see #packClippedRGB(int, int, int)
	 */
	public static int packRGB(int r, int g, int b) {
		return (255<<24) + ((r & 0xff)<<16) + ((g & 0xff)<<8) + (b & 0xff);
	}
	
	/**
	 * Make a packed RGB value from specified input values, clipping each to the range 0-255.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static int packClippedRGB(int r, int g, int b) {
		return packRGB(do8BitRangeCheck(r), do8BitRangeCheck(g), do8BitRangeCheck(b));
	}
	
	/**
	 * Get the red component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb & MASK_RED) >> 16;
	}
	
	/**
	 * Get the green component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb & MASK_GREEN) >> 8;
	}
	
	/**
	 * Get the blue component of a packed (A)RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & MASK_BLUE;
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255.
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return v < 0 ? 0 : (v > 255 ? 255 : v);
	}
	
	/**
	 * Round and clip an input value to be an integer in the range 0-255.
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return do8BitRangeCheck((int)Math.round(v));
	}

}
