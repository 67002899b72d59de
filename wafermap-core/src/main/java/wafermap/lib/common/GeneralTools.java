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

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.math3.util.Precision;

/**
 * A collection of generally-useful static methods.
 * 
 * @author WaferMap developers
 */
public final class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get extension from a filename. This is 'the final dot and beyond'; 
	 * if a dot is the final character then no extension is returned.
	 * The dot is included as the first character, and the extension is returned in lower case.
	 * @param name
	 * @return
	 * @see #getNameWithoutExtension(String)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int ind = name.lastIndexOf(".");
		if (ind < 0)
			return Optional.empty();
		String ext = name.substring(ind);
		// Check we only have letters or digits
		if (ext.equals(".") || !ext.matches(".\\w*"))
			return Optional.empty();
		return Optional.of(ext.toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Format a value with a fixed number of decimal places, always using '.' as the decimal separator.
	 * Values are rounded half-up first, so that 2.675 is shown as 2.68 rather than 2.67.
	 * 
	 * @param value
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String formatFixed(final double value, final int nDecimalPlaces) {
		if (!Double.isFinite(value))
			return Double.toString(value);
		double rounded = Precision.round(value, nDecimalPlaces);
		return String.format(Locale.US, "%." + nDecimalPlaces + "f", rounded);
	}
	
	/**
	 * Count the number of NaN or infinite values in an array.
	 * @param vals
	 * @return
	 */
	public static int numNonFinite(double[] vals) {
		int n = 0;
		for (double v : vals) {
			if (!Double.isFinite(v))
				n++;
		}
		return n;
	}

}
